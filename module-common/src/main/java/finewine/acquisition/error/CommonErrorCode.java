package finewine.acquisition.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 수집 코어 공통 에러 코드.
 *
 * <ul>
 *   <li>C0xx: 호출자 입력/설정 오류 (4xx)
 *   <li>S0xx: 외부 제공자 또는 내부 시스템 오류 (5xx)
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // Client
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  UNKNOWN_SOURCE("C002", "등록되지 않은 데이터 소스입니다 (source: %s)", HttpStatus.NOT_FOUND),
  UNKNOWN_CAPABILITY(
      "C003", "해당 capability를 제공하는 소스가 없습니다 (capability: %s)", HttpStatus.NOT_FOUND),
  UNKNOWN_CHECK("C004", "등록되지 않은 컴플라이언스 점검입니다 (check: %s)", HttpStatus.NOT_FOUND),
  INVALID_CHECK_INTERVAL(
      "C005", "점검 주기는 1분 이상이어야 합니다 (check: %s, minutes: %s)", HttpStatus.BAD_REQUEST),

  // Server
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다: %s", HttpStatus.INTERNAL_SERVER_ERROR),
  CIRCUIT_OPEN("S002", "서킷 브레이커가 열려 있어 호출을 차단했습니다 (source: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  ALL_SOURCES_EXHAUSTED(
      "S003", "모든 소스 호출에 실패했습니다 (capability: %s, failures: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  FETCH_CANCELLED(
      "S004", "데이터 수집이 취소되었습니다 (capability: %s, source: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  SOURCE_REGISTRATION_FAILED("S005", "데이터 소스 등록에 실패했습니다: %s", HttpStatus.INTERNAL_SERVER_ERROR),
  COMPLIANCE_REPORT_FAILED(
      "S006", "컴플라이언스 리포트 저장에 실패했습니다: %s", HttpStatus.INTERNAL_SERVER_ERROR),
  PROVIDER_RESPONSE_ERROR("S007", "외부 제공자 응답 오류 (source: %s, status: %s)", HttpStatus.BAD_GATEWAY);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
