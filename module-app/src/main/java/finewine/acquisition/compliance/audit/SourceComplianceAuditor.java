package finewine.acquisition.compliance.audit;

import finewine.acquisition.compliance.check.RateLimitInspector;
import finewine.acquisition.compliance.policy.AttributionRegistry;
import finewine.acquisition.compliance.policy.RetentionPolicyRegistry;
import finewine.acquisition.compliance.policy.TermsOfServiceRegistry;
import finewine.acquisition.domain.model.circuit.CircuitState;
import finewine.acquisition.domain.model.monitor.FreshnessRecord;
import finewine.acquisition.domain.model.monitor.FreshnessReport;
import finewine.acquisition.domain.model.source.RegisteredSource;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.infrastructure.resilience.SourceCircuitBreaker;
import finewine.acquisition.monitor.PipelineMonitor;
import finewine.acquisition.source.SourceRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;

/**
 * 등록된 모든 소스에 대한 감사 보고서를 만듭니다.
 *
 * <p>준수 여부는 rate limit, 출처 표기, 약관만으로 판정합니다. 신선도와 서킷 상태는 권고 사항으로만 기록됩니다.
 */
@RequiredArgsConstructor
public class SourceComplianceAuditor {

  private final SourceRegistry registry;
  private final RateLimitInspector rateLimitInspector;
  private final AttributionRegistry attributions;
  private final TermsOfServiceRegistry termsOfService;
  private final RetentionPolicyRegistry retentionPolicies;
  private final SourceCircuitBreaker circuitBreaker;
  private final PipelineMonitor monitor;
  private final Clock clock;

  public AuditReport audit() {
    Map<String, SourceAudit> sources = new LinkedHashMap<>();
    List<String> recommendations = new ArrayList<>();

    for (RegisteredSource source : registry.all()) {
      SourceAudit audit = auditSource(source);
      sources.put(source.id().value(), audit);
      if (audit.active() && !audit.fresh()) {
        recommendations.add("Investigate stale source " + audit.source());
      }
      if (!CircuitState.CLOSED.name().equals(audit.circuitState())) {
        recommendations.add(
            "Check provider health for " + audit.source() + " (circuit " + audit.circuitState() + ")");
      }
    }
    if (sources.values().stream().anyMatch(audit -> !audit.compliant())) {
      recommendations.add(0, "Review and fix compliance issues immediately");
    }

    return new AuditReport(
        clock.instant(),
        Collections.unmodifiableMap(sources),
        retentionPolicies.describeAll(),
        recommendations);
  }

  private SourceAudit auditSource(RegisteredSource source) {
    SourceId id = source.id();
    List<String> issues = new ArrayList<>();
    issues.addAll(rateLimitInspector.issuesFor(id));
    issues.addAll(attributions.issuesFor(id));
    issues.addAll(termsOfService.issuesFor(id));

    FreshnessReport freshness = monitor.checkFreshness(id);
    FreshnessRecord record = monitor.freshness(id);
    return new SourceAudit(
        id.value(),
        issues.isEmpty(),
        issues,
        source.definition().active(),
        circuitBreaker.getState(id).name(),
        freshness.fresh(),
        record.lastSuccess(),
        record.failureStreak(),
        record.errorRate(),
        attributions.renderHtml(id));
  }
}
