package finewine.acquisition.error.exception.base;

import finewine.acquisition.error.ErrorCode;
import lombok.Getter;

/** 모든 도메인 예외의 루트. 메시지는 {@link ErrorCode#getMessage()} 템플릿에 인자를 채워 만듭니다. */
@Getter
public abstract class BaseException extends RuntimeException {
  private final ErrorCode errorCode;
  private final String message;

  protected BaseException(ErrorCode errorCode) {
    super(errorCode.getMessage());
    this.errorCode = errorCode;
    this.message = errorCode.getMessage();
  }

  protected BaseException(ErrorCode errorCode, Object... args) {
    this(errorCode, null, args);
  }

  protected BaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode.getMessage(), cause);
    this.errorCode = errorCode;
    this.message = errorCode.getMessage();
  }

  protected BaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(String.format(errorCode.getMessage(), args), cause);
    this.errorCode = errorCode;
    this.message = String.format(errorCode.getMessage(), args);
  }
}
