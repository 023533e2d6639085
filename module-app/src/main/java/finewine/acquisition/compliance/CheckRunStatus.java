package finewine.acquisition.compliance;

import java.util.Locale;

public enum CheckRunStatus {
  COMPLETED,
  FAILED,
  /** 같은 점검이 이미 실행 중이라 건너뜀 */
  SKIPPED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
