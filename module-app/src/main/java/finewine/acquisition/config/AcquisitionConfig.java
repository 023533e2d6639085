package finewine.acquisition.config;

import finewine.acquisition.config.AcquisitionProperties.SourceProperties;
import finewine.acquisition.core.port.out.AlertPublisher;
import finewine.acquisition.core.port.out.FetchOutcomeListener;
import finewine.acquisition.core.port.out.SourceFetcher;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.infrastructure.executor.LogicExecutor;
import finewine.acquisition.infrastructure.ratelimit.SourceRateLimiter;
import finewine.acquisition.infrastructure.resilience.CircuitStateListener;
import finewine.acquisition.infrastructure.resilience.DefaultFailureClassifier;
import finewine.acquisition.infrastructure.resilience.SourceCircuitBreaker;
import finewine.acquisition.monitor.CostTracker;
import finewine.acquisition.monitor.PipelineMonitor;
import finewine.acquisition.monitoring.CircuitBreakerEventLogger;
import finewine.acquisition.monitoring.DegradationTracker;
import finewine.acquisition.orchestrator.FailoverOrchestrator;
import finewine.acquisition.source.SourceRegistry;
import finewine.acquisition.source.SourceRegistryFactory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.HashSet;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * 수집 코어 조립.
 *
 * <p>소스 정의는 기동 시 한 번 만들어져 {@link SourceRegistry} 로 고정되고, rate limiter 와 서킷 브레이커는 같은 정의로
 * 등록됩니다. 소스별 {@code failure-statuses} 는 기본 분류기에 추가 실패 상태로 반영됩니다.
 */
@Configuration
public class AcquisitionConfig {

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public SourceRegistry sourceRegistry(
      AcquisitionProperties properties,
      ObjectProvider<WebClient.Builder> webClientBuilder,
      ObjectProvider<SourceFetcher> fetchers) {
    return new SourceRegistryFactory(webClientBuilder.getIfAvailable(WebClient::builder))
        .create(properties, fetchers.orderedStream().toList());
  }

  @Bean
  public SourceRateLimiter sourceRateLimiter(
      SourceRegistry registry, Clock clock, MeterRegistry meterRegistry) {
    SourceRateLimiter rateLimiter = new SourceRateLimiter(clock, meterRegistry);
    registry
        .all()
        .forEach(source -> rateLimiter.register(source.id(), source.definition().rateLimit()));
    return rateLimiter;
  }

  @Bean
  public CostTracker costTracker(Clock clock) {
    return new CostTracker(clock);
  }

  @Bean
  public PipelineMonitor pipelineMonitor(
      Clock clock,
      MonitorProperties properties,
      AlertPublisher alertPublisher,
      MeterRegistry meterRegistry,
      LogicExecutor executor,
      ObjectProvider<FetchOutcomeListener> listeners) {
    return new PipelineMonitor(
        clock,
        properties,
        alertPublisher,
        meterRegistry,
        executor,
        listeners.orderedStream().toList());
  }

  @Bean
  public CircuitBreakerEventLogger circuitBreakerEventLogger(
      PipelineMonitor monitor, MeterRegistry meterRegistry) {
    return new CircuitBreakerEventLogger(monitor, meterRegistry);
  }

  @Bean
  public DegradationTracker degradationTracker(SourceRegistry registry, PipelineMonitor monitor) {
    return new DegradationTracker(registry, monitor);
  }

  @Bean
  public SourceCircuitBreaker sourceCircuitBreaker(
      AcquisitionProperties properties,
      SourceRegistry registry,
      Clock clock,
      CircuitBreakerEventLogger eventLogger,
      DegradationTracker degradationTracker) {
    SourceCircuitBreaker circuitBreaker =
        new SourceCircuitBreaker(
            clock, CircuitStateListener.composite(eventLogger, degradationTracker));
    for (SourceProperties source : properties.sources()) {
      SourceId id = source.id();
      circuitBreaker.register(
          id,
          registry.require(id).definition().circuitBreaker(),
          new DefaultFailureClassifier(new HashSet<>(source.failureStatuses())));
    }
    return circuitBreaker;
  }

  @Bean
  public FailoverOrchestrator failoverOrchestrator(
      SourceRegistry registry,
      SourceRateLimiter rateLimiter,
      SourceCircuitBreaker circuitBreaker,
      PipelineMonitor monitor,
      @Qualifier("fetchExecutor") ThreadPoolTaskExecutor fetchExecutor,
      Clock clock,
      MeterRegistry meterRegistry,
      AcquisitionProperties properties) {
    return new FailoverOrchestrator(
        registry,
        rateLimiter,
        circuitBreaker,
        monitor,
        fetchExecutor,
        clock,
        meterRegistry,
        properties.fetch().defaultDeadline());
  }
}
