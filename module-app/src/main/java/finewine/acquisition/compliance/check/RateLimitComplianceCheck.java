package finewine.acquisition.compliance.check;

import finewine.acquisition.compliance.CheckReport;
import finewine.acquisition.compliance.ComplianceCheck;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.compliance.CheckId;
import finewine.acquisition.domain.model.source.RegisteredSource;
import finewine.acquisition.source.SourceRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class RateLimitComplianceCheck implements ComplianceCheck {

  private final SourceRegistry registry;
  private final RateLimitInspector inspector;

  @Override
  public CheckId id() {
    return CheckId.RATE_LIMITING;
  }

  @Override
  public Duration defaultInterval() {
    return Duration.ofMinutes(15);
  }

  @Override
  public CheckReport run() {
    List<String> issues = new ArrayList<>();
    for (RegisteredSource source : registry.all()) {
      issues.addAll(inspector.issuesFor(source.id()));
    }
    return CheckReport.withIssues(
        id(),
        AlertSeverity.WARNING,
        issues.isEmpty()
            ? "Rate limiting compliance check passed for " + registry.ids().size() + " sources"
            : "Rate limiting compliance issues",
        issues);
  }
}
