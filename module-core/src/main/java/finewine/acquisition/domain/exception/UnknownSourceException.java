package finewine.acquisition.domain.exception;

import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.error.CommonErrorCode;
import finewine.acquisition.error.exception.base.ClientBaseException;

public class UnknownSourceException extends ClientBaseException {

  public UnknownSourceException(SourceId source) {
    super(CommonErrorCode.UNKNOWN_SOURCE, source.value());
  }
}
