package finewine.acquisition.compliance.policy;

import java.time.Duration;
import java.util.Optional;

/**
 * 데이터 분류별 보존 기간.
 *
 * @param retentionDays 보존 일수, 무기한이면 null
 */
public record RetentionPolicy(String dataType, String category, Integer retentionDays) {

  public static final String INDEFINITE = "indefinite";

  /** {@code "indefinite"} 또는 양의 정수 문자열 */
  public static RetentionPolicy parse(String dataType, String category, String value) {
    String trimmed = value == null ? "" : value.trim();
    if (INDEFINITE.equalsIgnoreCase(trimmed)) {
      return new RetentionPolicy(dataType, category, null);
    }
    int days;
    try {
      days = Integer.parseInt(trimmed);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "retention for " + dataType + "." + category + " must be days or 'indefinite': " + value, e);
    }
    if (days <= 0) {
      throw new IllegalArgumentException(
          "retention for " + dataType + "." + category + " must be positive: " + days);
    }
    return new RetentionPolicy(dataType, category, days);
  }

  public boolean isFinite() {
    return retentionDays != null;
  }

  public Optional<Duration> retention() {
    return isFinite() ? Optional.of(Duration.ofDays(retentionDays)) : Optional.empty();
  }

  public String key() {
    return dataType + "." + category;
  }

  public String describe() {
    return isFinite() ? retentionDays + " days" : INDEFINITE;
  }
}
