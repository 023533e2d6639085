package finewine.acquisition.compliance.check;

import finewine.acquisition.compliance.CheckReport;
import finewine.acquisition.compliance.ComplianceCheck;
import finewine.acquisition.compliance.policy.TermsOfServiceRegistry;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.compliance.CheckId;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.source.SourceRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;

/** 모든 소스의 이용약관이 기록/수락되어 있는지. 위반은 법적 이슈이므로 CRITICAL. */
@RequiredArgsConstructor
public class TermsOfServiceCheck implements ComplianceCheck {

  private final SourceRegistry registry;
  private final TermsOfServiceRegistry termsOfService;

  @Override
  public CheckId id() {
    return CheckId.TOS_COMPLIANCE;
  }

  @Override
  public Duration defaultInterval() {
    return Duration.ofMinutes(720);
  }

  @Override
  public CheckReport run() {
    List<String> issues = new ArrayList<>();
    for (SourceId source : registry.ids()) {
      issues.addAll(termsOfService.issuesFor(source));
    }
    return CheckReport.withIssues(
        id(),
        AlertSeverity.CRITICAL,
        issues.isEmpty() ? "Terms of Service compliance check passed" : "ToS compliance issues",
        issues);
  }
}
