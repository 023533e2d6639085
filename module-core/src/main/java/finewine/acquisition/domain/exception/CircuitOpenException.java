package finewine.acquisition.domain.exception;

import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.error.CommonErrorCode;
import finewine.acquisition.error.exception.base.ServerBaseException;
import finewine.acquisition.error.exception.marker.CircuitBreakerIgnoreMarker;
import lombok.Getter;

/** 브레이커가 호출 없이 차단했을 때. 차단 자체는 실패 카운트에 다시 반영되지 않습니다. */
@Getter
public class CircuitOpenException extends ServerBaseException implements CircuitBreakerIgnoreMarker {

  private final SourceId source;

  public CircuitOpenException(SourceId source) {
    super(CommonErrorCode.CIRCUIT_OPEN, source.value());
    this.source = source;
  }
}
