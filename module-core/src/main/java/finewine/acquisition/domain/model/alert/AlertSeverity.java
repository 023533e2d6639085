package finewine.acquisition.domain.model.alert;

/** 알림 심각도. 선언 순서가 곧 심각도 순서입니다. */
public enum AlertSeverity {
  INFO,
  WARNING,
  ERROR,
  CRITICAL;

  public boolean isAtLeast(AlertSeverity other) {
    return compareTo(other) >= 0;
  }
}
