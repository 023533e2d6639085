package finewine.acquisition.compliance.check;

import finewine.acquisition.compliance.CheckReport;
import finewine.acquisition.compliance.ComplianceCheck;
import finewine.acquisition.compliance.policy.CostPolicy;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.compliance.CheckId;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.monitor.CostTracker;
import finewine.acquisition.source.SourceRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * 이번 달 요청 수와 비용을 점검합니다.
 *
 * <ul>
 *   <li>월 한도의 {@code alertRatio} 를 넘으면 경고
 *   <li>무료 소스에 비용이 발생하면 경고
 * </ul>
 *
 * <p>과금 정책이 없는 소스는 무료로 간주합니다.
 */
@Slf4j
public class CostMonitoringCheck implements ComplianceCheck {

  private final SourceRegistry registry;
  private final CostTracker costTracker;
  private final Map<SourceId, CostPolicy> policies;
  private final double alertRatio;

  public CostMonitoringCheck(
      SourceRegistry registry,
      CostTracker costTracker,
      Map<SourceId, CostPolicy> policies,
      double alertRatio) {
    if (alertRatio <= 0 || alertRatio > 1) {
      throw new IllegalArgumentException("alertRatio must be in (0, 1]: " + alertRatio);
    }
    this.registry = registry;
    this.costTracker = costTracker;
    this.policies = Map.copyOf(policies);
    this.alertRatio = alertRatio;
  }

  @Override
  public CheckId id() {
    return CheckId.COST_MONITORING;
  }

  @Override
  public Duration defaultInterval() {
    return Duration.ofMinutes(60);
  }

  @Override
  public CheckReport run() {
    List<String> issues = new ArrayList<>();
    BigDecimal totalCost = BigDecimal.ZERO;
    for (SourceId source : registry.ids()) {
      CostPolicy policy = policies.getOrDefault(source, CostPolicy.free(source));
      long requests = costTracker.requestsThisMonth(source);
      BigDecimal cost = policy.costOf(requests);
      totalCost = totalCost.add(cost);

      Long limit = policy.monthlyLimit();
      if (limit != null && requests > limit * alertRatio) {
        issues.add(source + " approaching usage limit: " + requests + "/" + limit);
      }
      if (policy.free() && cost.signum() > 0) {
        issues.add("Unexpected cost for " + source + ": $" + cost.toPlainString());
      }
    }
    log.info(
        "[CostMonitoring] Cost compliance check completed for {}. Total cost: ${}",
        costTracker.currentMonth(),
        totalCost.toPlainString());
    return CheckReport.withIssues(
        id(),
        AlertSeverity.WARNING,
        issues.isEmpty() ? "Cost compliance check passed" : "Cost compliance alerts",
        issues);
  }
}
