package finewine.acquisition.error.exception.base;

import finewine.acquisition.error.ErrorCode;

/** 외부 제공자 장애나 내부 오류로 발생하는 5xx 계열 예외. 원인(cause)을 함께 보존해 장애 분석에 사용합니다. */
public abstract class ServerBaseException extends BaseException {

  protected ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  protected ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  protected ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  protected ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
