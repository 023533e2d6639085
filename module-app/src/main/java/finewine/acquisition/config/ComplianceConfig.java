package finewine.acquisition.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import finewine.acquisition.compliance.ComplianceCheck;
import finewine.acquisition.compliance.ComplianceHistory;
import finewine.acquisition.compliance.ComplianceScheduler;
import finewine.acquisition.compliance.audit.AuditReportWriter;
import finewine.acquisition.compliance.audit.SourceComplianceAuditor;
import finewine.acquisition.compliance.check.AttributionComplianceCheck;
import finewine.acquisition.compliance.check.CostMonitoringCheck;
import finewine.acquisition.compliance.check.DataRetentionCheck;
import finewine.acquisition.compliance.check.FullAuditCheck;
import finewine.acquisition.compliance.check.RateLimitComplianceCheck;
import finewine.acquisition.compliance.check.RateLimitInspector;
import finewine.acquisition.compliance.check.TermsOfServiceCheck;
import finewine.acquisition.compliance.policy.AttributionPolicy;
import finewine.acquisition.compliance.policy.AttributionRegistry;
import finewine.acquisition.compliance.policy.CostPolicy;
import finewine.acquisition.compliance.policy.RetentionPolicyRegistry;
import finewine.acquisition.compliance.policy.TermsOfService;
import finewine.acquisition.compliance.policy.TermsOfServiceRegistry;
import finewine.acquisition.compliance.retention.LoggingRetentionCleaner;
import finewine.acquisition.core.port.out.RetentionCleaner;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.infrastructure.executor.LogicExecutor;
import finewine.acquisition.infrastructure.ratelimit.SourceRateLimiter;
import finewine.acquisition.infrastructure.resilience.SourceCircuitBreaker;
import finewine.acquisition.lifecycle.ComplianceSchedulerLifecycle;
import finewine.acquisition.monitor.CostTracker;
import finewine.acquisition.monitor.PipelineMonitor;
import finewine.acquisition.source.SourceRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 컴플라이언스 점검 조립.
 *
 * <p>정책 레지스트리는 {@code acquisition.compliance.*} 에서 만들어지고, 점검 6종은 모두 {@link ComplianceScheduler} 에
 * 등록됩니다. {@code acquisition.compliance.enabled=false} 면 자동 시작만 꺼지고 수동 실행은 가능합니다.
 *
 * <p>YAML 에서 밑줄이 들어간 맵 키는 {@code "[rate_limiting]"} 처럼 대괄호로 감싸야 그대로 바인딩됩니다.
 */
@Configuration
public class ComplianceConfig {

  @Bean
  public AttributionRegistry attributionRegistry(ComplianceProperties properties) {
    Map<SourceId, AttributionPolicy> policies = new HashMap<>();
    properties
        .attributions()
        .forEach(
            (name, attribution) ->
                policies.put(
                    SourceId.of(name),
                    new AttributionPolicy(
                        SourceId.of(name),
                        attribution.required(),
                        attribution.text(),
                        attribution.url(),
                        attribution.position(),
                        attribution.visibility(),
                        attribution.linkRequired())));
    return new AttributionRegistry(policies);
  }

  @Bean
  public TermsOfServiceRegistry termsOfServiceRegistry(ComplianceProperties properties) {
    Map<SourceId, TermsOfService> terms = new HashMap<>();
    properties
        .termsOfService()
        .forEach(
            (name, tos) ->
                terms.put(
                    SourceId.of(name),
                    new TermsOfService(
                        SourceId.of(name),
                        tos.version(),
                        tos.accepted(),
                        tos.maxRequests(),
                        tos.period(),
                        tos.keyTerms())));
    return new TermsOfServiceRegistry(terms);
  }

  @Bean
  public RetentionPolicyRegistry retentionPolicyRegistry(ComplianceProperties properties) {
    return RetentionPolicyRegistry.fromConfig(properties.retention());
  }

  @Bean
  @ConditionalOnMissingBean(RetentionCleaner.class)
  public RetentionCleaner retentionCleaner() {
    return new LoggingRetentionCleaner();
  }

  @Bean
  public ComplianceHistory complianceHistory(ComplianceProperties properties) {
    return new ComplianceHistory(properties.historySize());
  }

  @Bean
  public RateLimitInspector rateLimitInspector(
      SourceRateLimiter rateLimiter, TermsOfServiceRegistry termsOfService, PipelineMonitor monitor) {
    return new RateLimitInspector(rateLimiter, termsOfService, monitor);
  }

  @Bean
  public SourceComplianceAuditor sourceComplianceAuditor(
      SourceRegistry registry,
      RateLimitInspector rateLimitInspector,
      AttributionRegistry attributions,
      TermsOfServiceRegistry termsOfService,
      RetentionPolicyRegistry retentionPolicies,
      SourceCircuitBreaker circuitBreaker,
      PipelineMonitor monitor,
      Clock clock) {
    return new SourceComplianceAuditor(
        registry,
        rateLimitInspector,
        attributions,
        termsOfService,
        retentionPolicies,
        circuitBreaker,
        monitor,
        clock);
  }

  @Bean
  public AuditReportWriter auditReportWriter(
      ObjectMapper objectMapper, ComplianceProperties properties, LogicExecutor executor) {
    return new AuditReportWriter(objectMapper, properties.reportsPath(), executor);
  }

  // ==================== Checks ====================

  @Bean
  public RateLimitComplianceCheck rateLimitComplianceCheck(
      SourceRegistry registry, RateLimitInspector inspector) {
    return new RateLimitComplianceCheck(registry, inspector);
  }

  @Bean
  public AttributionComplianceCheck attributionComplianceCheck(
      SourceRegistry registry, AttributionRegistry attributions) {
    return new AttributionComplianceCheck(registry, attributions);
  }

  @Bean
  public DataRetentionCheck dataRetentionCheck(
      RetentionPolicyRegistry policies, RetentionCleaner cleaner, LogicExecutor executor, Clock clock) {
    return new DataRetentionCheck(policies, cleaner, executor, clock);
  }

  @Bean
  public TermsOfServiceCheck termsOfServiceCheck(
      SourceRegistry registry, TermsOfServiceRegistry termsOfService) {
    return new TermsOfServiceCheck(registry, termsOfService);
  }

  @Bean
  public CostMonitoringCheck costMonitoringCheck(
      SourceRegistry registry, CostTracker costTracker, ComplianceProperties properties) {
    Map<SourceId, CostPolicy> policies = new HashMap<>();
    properties
        .costs()
        .forEach(
            (name, cost) ->
                policies.put(
                    SourceId.of(name),
                    new CostPolicy(
                        SourceId.of(name), cost.costPerRequest(), cost.monthlyLimit(), cost.free())));
    return new CostMonitoringCheck(registry, costTracker, policies, properties.costAlertRatio());
  }

  @Bean
  public FullAuditCheck fullAuditCheck(
      SourceComplianceAuditor auditor, AuditReportWriter writer, ComplianceHistory history) {
    return new FullAuditCheck(auditor, writer, history);
  }

  // ==================== Scheduler ====================

  @Bean
  public ComplianceScheduler complianceScheduler(
      List<ComplianceCheck> checks,
      ComplianceProperties properties,
      PipelineMonitor monitor,
      @Qualifier("complianceTaskScheduler") ThreadPoolTaskScheduler taskScheduler,
      LogicExecutor executor,
      ComplianceHistory history,
      MeterRegistry meterRegistry,
      Clock clock) {
    return new ComplianceScheduler(
        checks,
        properties.intervals(),
        properties.tick(),
        monitor,
        taskScheduler,
        executor,
        history,
        meterRegistry,
        clock);
  }

  @Bean
  @ConditionalOnProperty(
      name = "acquisition.compliance.enabled",
      havingValue = "true",
      matchIfMissing = true)
  public ComplianceSchedulerLifecycle complianceSchedulerLifecycle(ComplianceScheduler scheduler) {
    return new ComplianceSchedulerLifecycle(scheduler);
  }
}
