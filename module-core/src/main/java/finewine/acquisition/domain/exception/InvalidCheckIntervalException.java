package finewine.acquisition.domain.exception;

import finewine.acquisition.domain.model.compliance.CheckId;
import finewine.acquisition.error.CommonErrorCode;
import finewine.acquisition.error.exception.base.ClientBaseException;

public class InvalidCheckIntervalException extends ClientBaseException {

  public InvalidCheckIntervalException(CheckId checkId, long minutes) {
    super(CommonErrorCode.INVALID_CHECK_INTERVAL, checkId.value(), minutes);
  }
}
