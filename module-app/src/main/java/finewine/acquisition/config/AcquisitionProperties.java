package finewine.acquisition.config;

import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.CircuitBreakerSpec;
import finewine.acquisition.domain.model.source.RateLimitSpec;
import finewine.acquisition.domain.model.source.SourceDefinition;
import finewine.acquisition.domain.model.source.SourceId;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 데이터 소스 등록 설정.
 *
 * <pre>{@code
 * acquisition:
 *   sources:
 *     - name: mlb_api
 *       capabilities: [player_stats, schedule]
 *       base-url: https://statsapi.mlb.com
 *       endpoints:
 *         player_stats: /api/v1/people/{player_id}/stats?stats=season&season={season}
 *       max-calls: 10
 *       period: 1s
 *     - name: fangraphs
 *       max-calls: 1
 *       period: 1s
 *   fetch:
 *     pool-size: 8
 *     default-deadline: 30s
 * }</pre>
 *
 * <p>목록 순서가 기본 우선순위입니다. {@code priority} 를 지정하면 그 값이 우선합니다.
 */
@Validated
@ConfigurationProperties(prefix = "acquisition")
public record AcquisitionProperties(@Valid List<SourceProperties> sources, @Valid FetchProperties fetch) {

  public AcquisitionProperties {
    sources = sources == null ? List.of() : List.copyOf(sources);
    if (fetch == null) {
      fetch = FetchProperties.defaults();
    }
  }

  public record SourceProperties(
      @NotBlank String name,
      Integer priority,
      @DefaultValue("true") boolean active,
      List<String> capabilities,
      String baseUrl,
      Map<String, String> endpoints,
      @DefaultValue("1") @Min(1) int maxCalls,
      @DefaultValue("1s") Duration period,
      @DefaultValue("5") @Min(1) int failureThreshold,
      @DefaultValue("60s") Duration recoveryTimeout,
      @DefaultValue("3") @Min(1) int successThreshold,
      @DefaultValue("10s") Duration attemptTimeout,
      List<Integer> failureStatuses) {

    public SourceProperties {
      capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
      endpoints = endpoints == null ? Map.of() : Map.copyOf(endpoints);
      failureStatuses = failureStatuses == null ? List.of() : List.copyOf(failureStatuses);
    }

    public SourceId id() {
      return SourceId.of(name);
    }

    /** endpoint 만 선언하고 capabilities 를 생략하면 endpoint 키를 capability 로 사용합니다. */
    public List<Capability> resolvedCapabilities() {
      List<String> names = capabilities.isEmpty() ? List.copyOf(endpoints.keySet()) : capabilities;
      return names.stream().map(Capability::of).toList();
    }

    public SourceDefinition toDefinition(int defaultPriority) {
      return new SourceDefinition(
          id(),
          priority == null ? defaultPriority : priority,
          resolvedCapabilities(),
          RateLimitSpec.of(maxCalls, period),
          new CircuitBreakerSpec(failureThreshold, recoveryTimeout, successThreshold),
          attemptTimeout,
          active);
    }
  }

  public record FetchProperties(
      @DefaultValue("8") @Min(1) int poolSize,
      @DefaultValue("64") @Min(0) int queueCapacity,
      @DefaultValue("30s") Duration defaultDeadline) {

    public FetchProperties {
      if (defaultDeadline == null || defaultDeadline.isNegative() || defaultDeadline.isZero()) {
        throw new IllegalArgumentException(
            "acquisition.fetch.default-deadline must be positive, got: " + defaultDeadline);
      }
    }

    public static FetchProperties defaults() {
      return new FetchProperties(8, 64, Duration.ofSeconds(30));
    }
  }
}
