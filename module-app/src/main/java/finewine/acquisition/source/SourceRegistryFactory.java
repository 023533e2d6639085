package finewine.acquisition.source;

import finewine.acquisition.config.AcquisitionProperties;
import finewine.acquisition.config.AcquisitionProperties.SourceProperties;
import finewine.acquisition.core.port.out.SourceFetcher;
import finewine.acquisition.domain.exception.SourceRegistrationException;
import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.RegisteredSource;
import finewine.acquisition.domain.model.source.SourceDefinition;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.infrastructure.external.WebClientSourceFetcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * 설정과 fetcher 빈으로 {@link SourceRegistry} 를 조립합니다.
 *
 * <ul>
 *   <li>같은 id 의 {@link SourceFetcher} 빈이 있으면 그것을 사용
 *   <li>없고 endpoints 가 설정되어 있으면 {@link WebClientSourceFetcher} 생성
 *   <li>둘 다 없으면 기동 실패 ({@link SourceRegistrationException})
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class SourceRegistryFactory {

  private final WebClient.Builder webClientBuilder;

  public SourceRegistry create(AcquisitionProperties properties, List<SourceFetcher> fetcherBeans) {
    Map<SourceId, SourceFetcher> fetchers = new LinkedHashMap<>();
    for (SourceFetcher fetcher : fetcherBeans) {
      if (fetchers.putIfAbsent(fetcher.sourceId(), fetcher) != null) {
        throw new SourceRegistrationException(
            "multiple fetchers registered for source '" + fetcher.sourceId() + "'");
      }
    }

    List<RegisteredSource> registrations = new ArrayList<>();
    List<SourceProperties> sources = properties.sources();
    for (int i = 0; i < sources.size(); i++) {
      SourceProperties source = sources.get(i);
      SourceDefinition definition = source.toDefinition(i);
      SourceFetcher fetcher = fetchers.remove(definition.id());
      if (fetcher == null) {
        fetcher = httpFetcher(source, definition);
      }
      registrations.add(new RegisteredSource(definition, fetcher));
      log.info(
          "[SourceRegistry] Registered source={}, priority={}, capabilities={}, rateLimit={}/{}, active={}",
          definition.id(),
          definition.priority(),
          definition.capabilities(),
          definition.rateLimit().maxCalls(),
          definition.rateLimit().period(),
          definition.active());
    }
    fetchers
        .keySet()
        .forEach(id -> log.warn("[SourceRegistry] Fetcher for unconfigured source ignored: {}", id));
    return new SourceRegistry(registrations);
  }

  private SourceFetcher httpFetcher(SourceProperties source, SourceDefinition definition) {
    if (source.endpoints().isEmpty()) {
      throw new SourceRegistrationException(
          "source '" + definition.id() + "' has neither a fetcher bean nor configured endpoints");
    }
    if (source.baseUrl() == null || source.baseUrl().isBlank()) {
      throw new SourceRegistrationException(
          "source '" + definition.id() + "' declares endpoints without base-url");
    }
    Map<Capability, String> endpoints = new LinkedHashMap<>();
    source.endpoints().forEach((capability, uri) -> endpoints.put(Capability.of(capability), uri));
    WebClient webClient = webClientBuilder.clone().baseUrl(source.baseUrl()).build();
    return new WebClientSourceFetcher(
        definition.id(), webClient, endpoints, definition.attemptTimeout());
  }
}
