package finewine.acquisition.monitoring;

import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.circuit.CircuitBreakerSnapshot;
import finewine.acquisition.domain.model.circuit.CircuitState;
import finewine.acquisition.domain.model.circuit.StateTransition;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.infrastructure.resilience.CircuitStateListener;
import finewine.acquisition.monitor.PipelineMonitor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 서킷 상태 전이를 로그/메트릭/알림으로 내보냅니다.
 *
 * <ul>
 *   <li>OPEN 진입: ERROR 알림
 *   <li>OPEN/HALF_OPEN → CLOSED 복구: INFO 알림
 *   <li>HALF_OPEN 진입: 로그만
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class CircuitBreakerEventLogger implements CircuitStateListener {

  private static final String COMPONENT = "CircuitBreaker";

  private final PipelineMonitor monitor;
  private final MeterRegistry meterRegistry;

  @Override
  public void onStateTransition(
      SourceId source, StateTransition transition, CircuitBreakerSnapshot snapshot) {
    log.info(
        "[CircuitBreaker:{}] State transition: {} → {} ({})",
        source,
        transition.from(),
        transition.to(),
        transition.reason());
    Counter.builder("acquisition.circuit.transitions")
        .tag("source", source.value())
        .tag("to", transition.to().name())
        .register(meterRegistry)
        .increment();

    if (transition.to() == CircuitState.OPEN) {
      monitor.sendAlert(
          AlertSeverity.ERROR,
          String.format(
              "Circuit breaker for %s opened after %d consecutive failures (%s); recovery in %s",
              source,
              transition.failureCount(),
              transition.reason(),
              snapshot.config().recoveryTimeout()),
          COMPONENT,
          source);
    } else if (transition.to() == CircuitState.CLOSED && transition.from() != CircuitState.CLOSED) {
      monitor.sendAlert(
          AlertSeverity.INFO,
          "Circuit breaker for " + source + " closed, source recovered",
          COMPONENT,
          source);
    }
  }
}
