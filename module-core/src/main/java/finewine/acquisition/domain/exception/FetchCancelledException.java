package finewine.acquisition.domain.exception;

import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.error.CommonErrorCode;
import finewine.acquisition.error.exception.base.ServerBaseException;
import lombok.Getter;

/** 호출자 deadline 초과 또는 스레드 인터럽트로 수집을 포기했을 때. */
@Getter
public class FetchCancelledException extends ServerBaseException {

  private final Capability capability;
  private final SourceId source;

  public FetchCancelledException(Capability capability, SourceId source, Throwable cause) {
    super(CommonErrorCode.FETCH_CANCELLED, cause, capability.value(), source);
    this.capability = capability;
    this.source = source;
  }
}
