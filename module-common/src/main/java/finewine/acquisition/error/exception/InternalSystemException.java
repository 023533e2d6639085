package finewine.acquisition.error.exception;

import finewine.acquisition.error.CommonErrorCode;
import finewine.acquisition.error.exception.base.ServerBaseException;

/** 분류되지 않은 checked/unchecked 예외를 감싸는 최종 예외. 예외 변환기의 기본 결과입니다. */
public class InternalSystemException extends ServerBaseException {

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause, taskName);
  }
}
