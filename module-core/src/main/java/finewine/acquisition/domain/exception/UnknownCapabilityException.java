package finewine.acquisition.domain.exception;

import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.error.CommonErrorCode;
import finewine.acquisition.error.exception.base.ClientBaseException;

public class UnknownCapabilityException extends ClientBaseException {

  public UnknownCapabilityException(Capability capability) {
    super(CommonErrorCode.UNKNOWN_CAPABILITY, capability.value());
  }
}
