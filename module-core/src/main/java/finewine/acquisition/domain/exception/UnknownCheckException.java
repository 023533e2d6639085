package finewine.acquisition.domain.exception;

import finewine.acquisition.domain.model.compliance.CheckId;
import finewine.acquisition.error.CommonErrorCode;
import finewine.acquisition.error.exception.base.ClientBaseException;

public class UnknownCheckException extends ClientBaseException {

  public UnknownCheckException(CheckId checkId) {
    super(CommonErrorCode.UNKNOWN_CHECK, checkId.value());
  }
}
