package finewine.acquisition.monitoring;

import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.circuit.CircuitBreakerSnapshot;
import finewine.acquisition.domain.model.circuit.CircuitState;
import finewine.acquisition.domain.model.circuit.StateTransition;
import finewine.acquisition.domain.model.monitor.DegradationLevel;
import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.RegisteredSource;
import finewine.acquisition.domain.model.source.SourceDefinition;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.infrastructure.resilience.CircuitStateListener;
import finewine.acquisition.monitor.PipelineMonitor;
import finewine.acquisition.source.SourceRegistry;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * 서킷 전이로부터 소스 가용성과 서비스 수준을 추적합니다.
 *
 * <p>활성 소스 중 서킷이 OPEN 이 아닌 소스를 "사용 가능"으로 봅니다 (HALF_OPEN 은 사용 가능).
 *
 * <ul>
 *   <li>소스 서킷이 열리면 같은 capability 를 가진 다음 가용 소스로의 failover 를 WARNING 으로, 대체 소스가 없으면
 *       CRITICAL 로 알립니다.
 *   <li>서비스 수준이 바뀔 때마다 수준별 등급으로 알립니다 (FULL 복귀는 INFO).
 * </ul>
 */
@Slf4j
public class DegradationTracker implements CircuitStateListener {

  private static final String COMPONENT = "GracefulDegradation";

  private final SourceRegistry registry;
  private final PipelineMonitor monitor;
  private final Map<SourceId, CircuitState> states = new ConcurrentHashMap<>();
  private DegradationLevel level;

  public DegradationTracker(SourceRegistry registry, PipelineMonitor monitor) {
    this.registry = registry;
    this.monitor = monitor;
    registry.ids().forEach(id -> states.put(id, CircuitState.CLOSED));
    this.level = evaluate().level();
    if (level != DegradationLevel.FULL) {
      log.warn("[Degradation] Starting at {} service level", level);
    }
  }

  @Override
  public void onStateTransition(
      SourceId source, StateTransition transition, CircuitBreakerSnapshot snapshot) {
    if (!registry.contains(source)) {
      return;
    }
    states.put(source, transition.to());
    if (transition.to() == CircuitState.OPEN) {
      notifyFailover(source);
    }

    DegradationStatus status;
    DegradationLevel previous;
    synchronized (this) {
      status = evaluate();
      previous = level;
      level = status.level();
    }
    if (previous != status.level()) {
      log.warn("[Degradation] Service level {} → {}", previous, status.level());
      monitor.sendAlert(status.level().severity(), describe(status), COMPONENT);
    }
  }

  public synchronized DegradationLevel currentLevel() {
    return level;
  }

  public DegradationStatus status() {
    return evaluate();
  }

  /** 같은 capability 를 가진 다음 가용 소스 (우선순위 순) */
  Optional<SourceId> backupFor(SourceId failed) {
    SourceDefinition failedDefinition = registry.require(failed).definition();
    return registry.all().stream()
        .filter(candidate -> !candidate.id().equals(failed))
        .filter(this::isAvailable)
        .filter(
            candidate ->
                candidate.definition().capabilities().stream().anyMatch(failedDefinition::supports))
        .map(RegisteredSource::id)
        .findFirst();
  }

  private void notifyFailover(SourceId failed) {
    Optional<SourceId> backup = backupFor(failed);
    if (backup.isPresent()) {
      monitor.sendAlert(
          AlertSeverity.WARNING,
          "Failing over from " + failed + " to " + backup.get(),
          COMPONENT,
          failed);
    } else {
      monitor.sendAlert(
          AlertSeverity.CRITICAL,
          "No backup source available after " + failed + " failure",
          COMPONENT,
          failed);
    }
  }

  private DegradationStatus evaluate() {
    Set<Capability> available = new LinkedHashSet<>();
    Set<Capability> unavailable = new LinkedHashSet<>();
    for (Capability capability : registry.capabilities()) {
      boolean served = registry.forCapability(capability).stream().anyMatch(this::isAvailable);
      (served ? available : unavailable).add(capability);
    }
    DegradationLevel computed =
        DegradationLevel.of(available.size(), registry.capabilities().size());
    return new DegradationStatus(computed, available, unavailable);
  }

  private boolean isAvailable(RegisteredSource source) {
    return source.definition().active()
        && states.getOrDefault(source.id(), CircuitState.CLOSED) != CircuitState.OPEN;
  }

  private static String describe(DegradationStatus status) {
    return switch (status.level()) {
      case FULL -> "Full service restored: all capabilities have an available source";
      case LIMITED -> "Limited service: unavailable capabilities " + status.unavailableCapabilities();
      case MINIMAL -> "Minimal service: only " + status.availableCapabilities() + " available";
      case EMERGENCY -> "Emergency mode: no data sources available";
    };
  }
}
