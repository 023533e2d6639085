package finewine.acquisition.domain.model.circuit;

public enum CircuitState {
  CLOSED,
  OPEN,
  HALF_OPEN
}
