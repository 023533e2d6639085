package finewine.acquisition.compliance.check;

import finewine.acquisition.compliance.CheckReport;
import finewine.acquisition.compliance.ComplianceCheck;
import finewine.acquisition.compliance.ComplianceHistory;
import finewine.acquisition.compliance.audit.AuditReport;
import finewine.acquisition.compliance.audit.AuditReportWriter;
import finewine.acquisition.compliance.audit.SourceComplianceAuditor;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.compliance.CheckId;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 전체 감사: 보고서 생성 → JSON 저장 → 이력 기록.
 *
 * <p>비준수 소스가 있으면 CRITICAL, 없으면 INFO. 저장 실패는 예외로 전파되어 스케줄러가 ERROR 로 처리합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class FullAuditCheck implements ComplianceCheck {

  private final SourceComplianceAuditor auditor;
  private final AuditReportWriter writer;
  private final ComplianceHistory history;

  @Override
  public CheckId id() {
    return CheckId.FULL_AUDIT;
  }

  @Override
  public Duration defaultInterval() {
    return Duration.ofMinutes(10080);
  }

  @Override
  public CheckReport run() {
    AuditReport report = auditor.audit();
    Path file = writer.write(report);
    List<String> criticalIssues = report.criticalIssues();

    history.add(
        new ComplianceHistory.Entry(
            report.generatedAt(),
            id().value(),
            "completed",
            criticalIssues.size(),
            report.generatedAt().toString(),
            file.toString()));
    log.info(
        "[FullAudit] Full compliance audit completed. Found {} critical issues", criticalIssues.size());

    if (criticalIssues.isEmpty()) {
      return CheckReport.info(
          id(), "Full compliance audit completed successfully - no critical issues found");
    }
    return CheckReport.withIssues(
        id(),
        AlertSeverity.CRITICAL,
        "Full audit found critical compliance issues",
        criticalIssues);
  }
}
