package finewine.acquisition.source;

import finewine.acquisition.domain.exception.SourceRegistrationException;
import finewine.acquisition.domain.exception.UnknownCapabilityException;
import finewine.acquisition.domain.exception.UnknownSourceException;
import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.RegisteredSource;
import finewine.acquisition.domain.model.source.SourceId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 기동 시 한 번 만들어지는 불변 소스 레지스트리.
 *
 * <p>capability 별 후보 목록은 우선순위 오름차순이며, 같은 우선순위는 등록 순서를 유지합니다.
 */
public class SourceRegistry {

  private final Map<SourceId, RegisteredSource> sources;
  private final Map<Capability, List<RegisteredSource>> byCapability;

  public SourceRegistry(List<RegisteredSource> registrations) {
    List<RegisteredSource> ordered = new ArrayList<>(registrations);
    ordered.sort(Comparator.comparingInt(source -> source.definition().priority()));

    Map<SourceId, RegisteredSource> byId = new LinkedHashMap<>();
    Map<Capability, List<RegisteredSource>> candidates = new LinkedHashMap<>();
    for (RegisteredSource source : ordered) {
      if (!source.fetcher().sourceId().equals(source.id())) {
        throw new SourceRegistrationException(
            "fetcher for '" + source.fetcher().sourceId() + "' bound to source '" + source.id() + "'");
      }
      if (byId.putIfAbsent(source.id(), source) != null) {
        throw new SourceRegistrationException("duplicate source id '" + source.id() + "'");
      }
      for (Capability capability : source.definition().capabilities()) {
        candidates.computeIfAbsent(capability, c -> new ArrayList<>()).add(source);
      }
    }
    this.sources = Collections.unmodifiableMap(byId);
    Map<Capability, List<RegisteredSource>> frozen = new LinkedHashMap<>();
    candidates.forEach((capability, list) -> frozen.put(capability, List.copyOf(list)));
    this.byCapability = Collections.unmodifiableMap(frozen);
  }

  public RegisteredSource require(SourceId source) {
    RegisteredSource registered = sources.get(source);
    if (registered == null) {
      throw new UnknownSourceException(source);
    }
    return registered;
  }

  /** @throws UnknownCapabilityException 해당 capability 를 가진 소스가 하나도 없을 때 */
  public List<RegisteredSource> forCapability(Capability capability) {
    List<RegisteredSource> candidates = byCapability.get(capability);
    if (candidates == null) {
      throw new UnknownCapabilityException(capability);
    }
    return candidates;
  }

  public List<RegisteredSource> all() {
    return List.copyOf(sources.values());
  }

  public Set<SourceId> ids() {
    return sources.keySet();
  }

  public Set<Capability> capabilities() {
    return byCapability.keySet();
  }

  public boolean contains(SourceId source) {
    return sources.containsKey(source);
  }
}
