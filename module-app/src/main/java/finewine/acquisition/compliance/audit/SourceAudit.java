package finewine.acquisition.compliance.audit;

import java.time.Instant;
import java.util.List;

/**
 * 감사 보고서의 소스별 항목.
 *
 * @param issues 준수 위반 사항 (rate limit, 출처 표기, 약관)
 * @param lastSuccess 마지막 성공 시각, 없으면 null
 */
public record SourceAudit(
    String source,
    boolean compliant,
    List<String> issues,
    boolean active,
    String circuitState,
    boolean fresh,
    Instant lastSuccess,
    int failureStreak,
    double errorRate,
    String attributionHtml) {

  public SourceAudit {
    issues = List.copyOf(issues);
  }
}
