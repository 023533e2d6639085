package finewine.acquisition.domain.model.monitor;

import finewine.acquisition.domain.model.alert.AlertSeverity;

/**
 * 사용 가능한 capability 비율로 정한 서비스 수준.
 *
 * <ul>
 *   <li>FULL: 모든 capability 에 쓸 수 있는 소스가 있음
 *   <li>LIMITED: 절반 이상
 *   <li>MINIMAL: 하나 이상
 *   <li>EMERGENCY: 없음
 * </ul>
 */
public enum DegradationLevel {
  FULL(AlertSeverity.INFO),
  LIMITED(AlertSeverity.WARNING),
  MINIMAL(AlertSeverity.ERROR),
  EMERGENCY(AlertSeverity.CRITICAL);

  private final AlertSeverity severity;

  DegradationLevel(AlertSeverity severity) {
    this.severity = severity;
  }

  /** 이 수준으로 바뀔 때 보낼 알림 등급 */
  public AlertSeverity severity() {
    return severity;
  }

  public static DegradationLevel of(int available, int total) {
    if (total == 0 || available >= total) {
      return FULL;
    }
    if (available * 2 >= total) {
      return LIMITED;
    }
    if (available >= 1) {
      return MINIMAL;
    }
    return EMERGENCY;
  }
}
