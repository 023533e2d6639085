package finewine.acquisition.error;

import org.springframework.http.HttpStatus;

/** 에러 코드 계약. 코드 문자열, 메시지 템플릿(String.format), HTTP 상태를 노출합니다. */
public interface ErrorCode {
  String getCode();

  String getMessage();

  HttpStatus getStatus();
}
