package finewine.acquisition.config;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 컴플라이언스 점검 설정.
 *
 * <ul>
 *   <li>{@code intervals}: 점검 이름 → 주기(분). 생략하면 점검별 기본 주기
 *   <li>{@code attributions} / {@code terms-of-service} / {@code costs}: 소스 이름 → 정책
 *   <li>{@code retention}: 데이터 그룹 → (분류 → 보존 일수 또는 {@code indefinite})
 * </ul>
 */
@ConfigurationProperties(prefix = "acquisition.compliance")
public record ComplianceProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("60s") Duration tick,
    Map<String, Long> intervals,
    @DefaultValue("compliance_reports") String reportsDir,
    @DefaultValue("50") int historySize,
    @DefaultValue("0.8") double costAlertRatio,
    Map<String, AttributionProperties> attributions,
    Map<String, TermsProperties> termsOfService,
    Map<String, CostProperties> costs,
    Map<String, Map<String, String>> retention) {

  public ComplianceProperties {
    intervals = intervals == null ? Map.of() : Map.copyOf(intervals);
    attributions = attributions == null ? Map.of() : Map.copyOf(attributions);
    termsOfService = termsOfService == null ? Map.of() : Map.copyOf(termsOfService);
    costs = costs == null ? Map.of() : Map.copyOf(costs);
    retention = retention == null ? Map.of() : Map.copyOf(retention);
    if (tick == null || tick.isNegative() || tick.isZero()) {
      throw new IllegalArgumentException("acquisition.compliance.tick must be positive: " + tick);
    }
    if (historySize <= 0) {
      throw new IllegalArgumentException("acquisition.compliance.history-size must be positive");
    }
  }

  public Path reportsPath() {
    return Path.of(reportsDir);
  }

  public record AttributionProperties(
      @DefaultValue("true") boolean required,
      String text,
      String url,
      String position,
      String visibility,
      @DefaultValue("false") boolean linkRequired) {}

  public record TermsProperties(
      String version,
      @DefaultValue("false") boolean accepted,
      Integer maxRequests,
      Duration period,
      List<String> keyTerms) {}

  public record CostProperties(
      @DefaultValue("0") BigDecimal costPerRequest,
      Long monthlyLimit,
      @DefaultValue("false") boolean free) {}
}
