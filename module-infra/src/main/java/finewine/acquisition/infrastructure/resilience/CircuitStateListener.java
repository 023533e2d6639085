package finewine.acquisition.infrastructure.resilience;

import finewine.acquisition.domain.model.circuit.CircuitBreakerSnapshot;
import finewine.acquisition.domain.model.circuit.StateTransition;
import finewine.acquisition.domain.model.source.SourceId;
import java.util.List;

/** 상태 전이 통지. 브레이커 락을 놓은 뒤 호출됩니다. */
@FunctionalInterface
public interface CircuitStateListener {

  CircuitStateListener NOOP = (source, transition, snapshot) -> {};

  void onStateTransition(
      SourceId source, StateTransition transition, CircuitBreakerSnapshot snapshot);

  /** 주어진 순서대로 모두 호출합니다. */
  static CircuitStateListener composite(CircuitStateListener... listeners) {
    List<CircuitStateListener> delegates = List.of(listeners);
    return (source, transition, snapshot) -> {
      for (CircuitStateListener delegate : delegates) {
        delegate.onStateTransition(source, transition, snapshot);
      }
    };
  }
}
