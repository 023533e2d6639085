package finewine.acquisition.domain.exception;

import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.error.CommonErrorCode;
import finewine.acquisition.error.exception.base.ServerBaseException;
import lombok.Getter;

/**
 * 제공자가 2xx 가 아닌 상태로 응답했을 때 fetch 함수가 던지는 예외.
 *
 * <p>브레이커의 실패 분류기는 {@link #getStatusCode()} 로 NOT_FOUND / RATE_LIMITED / HTTP_ERROR 를 구분합니다.
 */
@Getter
public class ProviderResponseException extends ServerBaseException {

  private final SourceId source;
  private final int statusCode;

  public ProviderResponseException(SourceId source, int statusCode) {
    super(CommonErrorCode.PROVIDER_RESPONSE_ERROR, source.value(), statusCode);
    this.source = source;
    this.statusCode = statusCode;
  }

  public ProviderResponseException(SourceId source, int statusCode, Throwable cause) {
    super(CommonErrorCode.PROVIDER_RESPONSE_ERROR, cause, source.value(), statusCode);
    this.source = source;
    this.statusCode = statusCode;
  }
}
