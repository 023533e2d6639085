package finewine.acquisition.domain.exception;

import finewine.acquisition.error.CommonErrorCode;
import finewine.acquisition.error.exception.base.ServerBaseException;

/** 기동 시 소스 설정이 잘못되었을 때 (중복 id, fetcher 누락 등). */
public class SourceRegistrationException extends ServerBaseException {

  public SourceRegistrationException(String detail) {
    super(CommonErrorCode.SOURCE_REGISTRATION_FAILED, detail);
  }
}
