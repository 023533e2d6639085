package finewine.acquisition.config;

import finewine.acquisition.compliance.ComplianceScheduler;
import finewine.acquisition.infrastructure.ratelimit.SourceRateLimiter;
import finewine.acquisition.infrastructure.resilience.SourceCircuitBreaker;
import finewine.acquisition.monitor.PipelineMonitor;
import finewine.acquisition.monitoring.DegradationTracker;
import finewine.acquisition.source.SourceRegistry;
import finewine.acquisition.status.AcquisitionStatusService;
import finewine.acquisition.status.DataSourcesHealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StatusConfig {

  @Bean
  public AcquisitionStatusService acquisitionStatusService(
      SourceRegistry registry,
      SourceCircuitBreaker circuitBreaker,
      SourceRateLimiter rateLimiter,
      PipelineMonitor monitor,
      ComplianceScheduler complianceScheduler,
      DegradationTracker degradationTracker) {
    return new AcquisitionStatusService(
        registry, circuitBreaker, rateLimiter, monitor, complianceScheduler, degradationTracker);
  }

  /** actuator 헬스 이름은 빈 이름에서 {@code HealthIndicator} 를 뗀 {@code dataSources} */
  @Bean
  public DataSourcesHealthIndicator dataSourcesHealthIndicator(
      AcquisitionStatusService statusService) {
    return new DataSourcesHealthIndicator(statusService);
  }
}
