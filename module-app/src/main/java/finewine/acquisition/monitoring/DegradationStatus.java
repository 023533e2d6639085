package finewine.acquisition.monitoring;

import finewine.acquisition.domain.model.monitor.DegradationLevel;
import finewine.acquisition.domain.model.source.Capability;
import java.util.Set;

public record DegradationStatus(
    DegradationLevel level,
    Set<Capability> availableCapabilities,
    Set<Capability> unavailableCapabilities) {

  public DegradationStatus {
    availableCapabilities = Set.copyOf(availableCapabilities);
    unavailableCapabilities = Set.copyOf(unavailableCapabilities);
  }
}
