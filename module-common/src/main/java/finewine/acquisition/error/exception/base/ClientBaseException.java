package finewine.acquisition.error.exception.base;

import finewine.acquisition.error.ErrorCode;

/**
 * 호출자의 입력이나 설정이 잘못되었을 때 발생하는 4xx 계열 예외.
 *
 * <p>알 수 없는 소스/점검 이름, 잘못된 점검 주기 등. 재시도해도 결과가 바뀌지 않습니다.
 */
public abstract class ClientBaseException extends BaseException {

  protected ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
