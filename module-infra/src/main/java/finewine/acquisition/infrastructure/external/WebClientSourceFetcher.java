package finewine.acquisition.infrastructure.external;

import finewine.acquisition.core.port.out.SourceFetcher;
import finewine.acquisition.domain.exception.ProviderResponseException;
import finewine.acquisition.domain.model.fetch.FetchRequest;
import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.SourceId;
import java.time.Duration;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * capability 별 URI 템플릿으로 GET 요청을 보내는 HTTP fetch 함수.
 *
 * <p>URI 템플릿 변수는 {@link FetchRequest#params()} 로 채웁니다. 예: {@code
 * /api/v1/people/{player_id}/stats?season={season}}
 *
 * <p>2xx 가 아닌 응답은 {@link ProviderResponseException}(상태 코드 포함)으로, 연결 오류는 WebClient 예외 그대로
 * 전파합니다. 응답 본문은 파싱하지 않고 문자열로 반환합니다.
 */
@Slf4j
public class WebClientSourceFetcher implements SourceFetcher {

  private final SourceId sourceId;
  private final WebClient webClient;
  private final Map<Capability, String> endpoints;
  private final Duration responseTimeout;

  public WebClientSourceFetcher(
      SourceId sourceId,
      WebClient webClient,
      Map<Capability, String> endpoints,
      Duration responseTimeout) {
    this.sourceId = sourceId;
    this.webClient = webClient;
    this.endpoints = Map.copyOf(endpoints);
    this.responseTimeout = responseTimeout;
  }

  @Override
  public SourceId sourceId() {
    return sourceId;
  }

  @Override
  public Object fetch(Capability capability, FetchRequest request) {
    String uriTemplate = endpoints.get(capability);
    if (uriTemplate == null) {
      throw new IllegalArgumentException(
          "source '" + sourceId + "' has no endpoint for capability '" + capability + "'");
    }
    try {
      return webClient
          .get()
          .uri(uriTemplate, request.params())
          .retrieve()
          .bodyToMono(String.class)
          .defaultIfEmpty("")
          .block(responseTimeout);
    } catch (WebClientResponseException e) {
      log.debug(
          "[WebClientSourceFetcher:{}] {} {} → {}",
          sourceId,
          capability,
          uriTemplate,
          e.getStatusCode().value());
      throw new ProviderResponseException(sourceId, e.getStatusCode().value(), e);
    }
  }

  public Map<Capability, String> getEndpoints() {
    return endpoints;
  }
}
