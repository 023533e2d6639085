package finewine.acquisition.status;

import finewine.acquisition.compliance.CheckRunResult;
import finewine.acquisition.compliance.ComplianceScheduler;
import finewine.acquisition.compliance.MonitoringStatus;
import finewine.acquisition.domain.exception.InvalidCheckIntervalException;
import finewine.acquisition.domain.exception.UnknownCheckException;
import finewine.acquisition.domain.exception.UnknownSourceException;
import finewine.acquisition.domain.model.circuit.CircuitBreakerSnapshot;
import finewine.acquisition.domain.model.compliance.CheckId;
import finewine.acquisition.domain.model.monitor.FreshnessRecord;
import finewine.acquisition.domain.model.source.RegisteredSource;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.infrastructure.ratelimit.SourceRateLimiter;
import finewine.acquisition.infrastructure.resilience.SourceCircuitBreaker;
import finewine.acquisition.monitor.PipelineMonitor;
import finewine.acquisition.monitoring.DegradationStatus;
import finewine.acquisition.monitoring.DegradationTracker;
import finewine.acquisition.source.SourceRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 상태 조회와 운영자 명령의 단일 진입점.
 *
 * <ul>
 *   <li>조회: {@link #getServiceHealth}, {@link #getAllServiceHealth}, {@link #getMonitoringStatus},
 *       {@link #getDegradationStatus}
 *   <li>명령: {@link #resetCircuitBreaker}, {@link #updateCheckInterval}, {@link #runManualCheck}
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class AcquisitionStatusService {

  private final SourceRegistry registry;
  private final SourceCircuitBreaker circuitBreaker;
  private final SourceRateLimiter rateLimiter;
  private final PipelineMonitor monitor;
  private final ComplianceScheduler complianceScheduler;
  private final DegradationTracker degradationTracker;

  /** @throws UnknownSourceException 등록되지 않은 소스 */
  public SourceHealth getServiceHealth(SourceId source) {
    RegisteredSource registered = registry.require(source);
    CircuitBreakerSnapshot circuit = circuitBreaker.getMetrics(source);
    FreshnessRecord freshness = monitor.freshness(source);
    return new SourceHealth(
        source,
        circuit.state(),
        circuit.failureCount(),
        rateLimiter.lastDispatch(source).orElse(null),
        registered.definition().active(),
        freshness.lastSuccess(),
        freshness.failureStreak(),
        freshness.errorRate());
  }

  public List<SourceHealth> getAllServiceHealth() {
    return registry.all().stream().map(source -> getServiceHealth(source.id())).toList();
  }

  public CircuitBreakerSnapshot getCircuitMetrics(SourceId source) {
    registry.require(source);
    return circuitBreaker.getMetrics(source);
  }

  public DegradationStatus getDegradationStatus() {
    return degradationTracker.status();
  }

  public MonitoringStatus getMonitoringStatus() {
    return complianceScheduler.getMonitoringStatus();
  }

  /** @throws UnknownSourceException 등록되지 않은 소스 */
  public CircuitBreakerSnapshot resetCircuitBreaker(SourceId source) {
    registry.require(source);
    CircuitBreakerSnapshot snapshot = circuitBreaker.reset(source);
    log.warn("[Admin] Circuit breaker reset: source={}", source);
    return snapshot;
  }

  /**
   * @throws UnknownCheckException 등록되지 않은 점검
   * @throws InvalidCheckIntervalException 0 이하의 주기
   */
  public void updateCheckInterval(CheckId check, long minutes) {
    complianceScheduler.updateCheckInterval(check, minutes);
  }

  /** @throws UnknownCheckException 등록되지 않은 점검 */
  public CheckRunResult runManualCheck(CheckId check) {
    return complianceScheduler.runManualCheck(check);
  }
}
