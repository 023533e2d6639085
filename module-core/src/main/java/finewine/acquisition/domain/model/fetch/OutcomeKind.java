package finewine.acquisition.domain.model.fetch;

/**
 * 단일 호출 시도의 결과 분류.
 *
 * <ul>
 *   <li>SUCCESS: 정상 응답
 *   <li>RATE_LIMITED: 제공자가 429 로 거절
 *   <li>CIRCUIT_OPEN: 브레이커가 호출 없이 차단
 *   <li>NOT_FOUND: 제공자에 데이터 없음 (브레이커 실패로 세지 않음)
 *   <li>TRANSPORT_ERROR: 연결 실패, 타임아웃 등 전송 계층 오류
 *   <li>HTTP_ERROR: 그 외 비정상 HTTP 상태
 *   <li>CANCELLED: 호출자 deadline 초과 또는 인터럽트로 시도 포기
 *   <li>SOURCE_INACTIVE: 비활성 소스라 시도하지 않음 (failover 실패 사유 전용)
 * </ul>
 */
public enum OutcomeKind {
  SUCCESS,
  RATE_LIMITED,
  CIRCUIT_OPEN,
  NOT_FOUND,
  TRANSPORT_ERROR,
  HTTP_ERROR,
  CANCELLED,
  SOURCE_INACTIVE;

  public boolean isSuccess() {
    return this == SUCCESS;
  }

  /**
   * 제공자 상태를 판단할 근거가 되는 결과인지. 취소, 서킷 차단, 비활성은 제공자 응답을 받지 못했으므로 성공도 실패도 아닙니다.
   */
  public boolean reflectsProviderHealth() {
    return this != CANCELLED && this != CIRCUIT_OPEN && this != SOURCE_INACTIVE;
  }

  /** 실제로 제공자에게 요청이 나갔을 수 있는 결과인지 (비용 집계 기준) */
  public boolean isDispatched() {
    return this != CIRCUIT_OPEN && this != SOURCE_INACTIVE;
  }
}
