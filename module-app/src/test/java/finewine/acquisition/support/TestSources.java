package finewine.acquisition.support;

import finewine.acquisition.core.port.out.SourceFetcher;
import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.CircuitBreakerSpec;
import finewine.acquisition.domain.model.source.RateLimitSpec;
import finewine.acquisition.domain.model.source.RegisteredSource;
import finewine.acquisition.domain.model.source.SourceDefinition;
import java.time.Duration;
import java.util.List;

/** 테스트용 소스 정의 빌더. rate limit 은 대기가 생기지 않을 만큼 느슨하게 둡니다. */
public final class TestSources {

  public static final Capability PLAYER_STATS = Capability.of("player_stats");
  public static final RateLimitSpec LOOSE_LIMIT = RateLimitSpec.perSecond(1000);

  private TestSources() {}

  public static RegisteredSource source(SourceFetcher fetcher, int priority) {
    return source(fetcher, priority, new CircuitBreakerSpec(5, Duration.ofSeconds(60), 3));
  }

  public static RegisteredSource source(
      SourceFetcher fetcher, int priority, CircuitBreakerSpec circuitBreaker) {
    return new RegisteredSource(
        new SourceDefinition(
            fetcher.sourceId(),
            priority,
            List.of(PLAYER_STATS),
            LOOSE_LIMIT,
            circuitBreaker,
            Duration.ofSeconds(5),
            true),
        fetcher);
  }

  public static RegisteredSource withAttemptTimeout(
      SourceFetcher fetcher, int priority, Duration attemptTimeout) {
    return new RegisteredSource(
        new SourceDefinition(
            fetcher.sourceId(),
            priority,
            List.of(PLAYER_STATS),
            LOOSE_LIMIT,
            CircuitBreakerSpec.defaults(),
            attemptTimeout,
            true),
        fetcher);
  }

  public static RegisteredSource inactive(SourceFetcher fetcher, int priority) {
    RegisteredSource active = source(fetcher, priority);
    return new RegisteredSource(active.definition().withActive(false), fetcher);
  }
}
