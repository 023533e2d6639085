package finewine.acquisition.compliance.check;

import finewine.acquisition.compliance.CheckReport;
import finewine.acquisition.compliance.ComplianceCheck;
import finewine.acquisition.compliance.policy.AttributionRegistry;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.compliance.CheckId;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.source.SourceRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;

/** 등록된 모든 소스의 출처 표기 설정이 완전한지 확인합니다. */
@RequiredArgsConstructor
public class AttributionComplianceCheck implements ComplianceCheck {

  private final SourceRegistry registry;
  private final AttributionRegistry attributions;

  @Override
  public CheckId id() {
    return CheckId.ATTRIBUTION;
  }

  @Override
  public Duration defaultInterval() {
    return Duration.ofMinutes(60);
  }

  @Override
  public CheckReport run() {
    List<String> issues = new ArrayList<>();
    for (SourceId source : registry.ids()) {
      issues.addAll(attributions.issuesFor(source));
    }
    return CheckReport.withIssues(
        id(),
        AlertSeverity.WARNING,
        issues.isEmpty() ? "Attribution compliance check passed" : "Attribution compliance issues",
        issues);
  }
}
