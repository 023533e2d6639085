package finewine.acquisition.compliance.audit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 전체 감사 보고서. {@link AuditReportWriter} 가 JSON 으로 저장합니다.
 *
 * @param sources 소스 이름 → 감사 결과 (등록 우선순위 순)
 * @param dataRetention 데이터 그룹 → (분류 → 보존 기간)
 */
public record AuditReport(
    Instant generatedAt,
    Map<String, SourceAudit> sources,
    Map<String, Map<String, String>> dataRetention,
    List<String> recommendations) {

  public AuditReport {
    recommendations = List.copyOf(recommendations);
  }

  /** 비준수 소스의 위반 사항을 {@code "source: issue"} 형태로 모읍니다. */
  @JsonIgnore
  public List<String> criticalIssues() {
    List<String> issues = new ArrayList<>();
    for (SourceAudit audit : sources.values()) {
      if (!audit.compliant()) {
        audit.issues().forEach(issue -> issues.add(audit.source() + ": " + issue));
      }
    }
    return issues;
  }

  @JsonIgnore
  public boolean isCompliant() {
    return sources.values().stream().allMatch(SourceAudit::compliant);
  }
}
