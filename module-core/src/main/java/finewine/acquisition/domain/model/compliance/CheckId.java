package finewine.acquisition.domain.model.compliance;

import java.util.Objects;

/** 컴플라이언스 점검 이름. 기본 점검 6종은 상수로 제공합니다. */
public record CheckId(String value) {

  public static final CheckId RATE_LIMITING = new CheckId("rate_limiting");
  public static final CheckId ATTRIBUTION = new CheckId("attribution");
  public static final CheckId DATA_RETENTION = new CheckId("data_retention");
  public static final CheckId TOS_COMPLIANCE = new CheckId("tos_compliance");
  public static final CheckId COST_MONITORING = new CheckId("cost_monitoring");
  public static final CheckId FULL_AUDIT = new CheckId("full_audit");

  public CheckId {
    Objects.requireNonNull(value, "CheckId value cannot be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException("CheckId value cannot be blank");
    }
  }

  public static CheckId of(String value) {
    return new CheckId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
