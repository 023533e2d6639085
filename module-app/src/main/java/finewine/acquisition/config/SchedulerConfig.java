package finewine.acquisition.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.Collections;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 컴플라이언스 tick 전용 스케줄러 ("compliance-").
 *
 * <ul>
 *   <li>종료 시 진행 중인 점검 완료를 {@code awaitTerminationSeconds} 까지 대기
 *   <li>거절은 {@code scheduler.rejected} 로 집계
 * </ul>
 */
@Slf4j
@Configuration
public class SchedulerConfig {

  @Bean(name = "complianceTaskScheduler")
  public ThreadPoolTaskScheduler complianceTaskScheduler(
      SchedulerProperties properties, MeterRegistry meterRegistry) {
    Counter rejected =
        Counter.builder("scheduler.rejected")
            .description("Number of scheduled tasks rejected")
            .register(meterRegistry);

    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.poolSize());
    scheduler.setThreadNamePrefix("compliance-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(properties.awaitTerminationSeconds());
    scheduler.setRejectedExecutionHandler(
        (r, e) -> {
          rejected.increment();
          if (e.isShutdown()) {
            throw new RejectedExecutionException("Scheduler rejected (shutdown in progress)");
          }
          log.warn("[TaskScheduler] Task rejected. poolSize={}, activeCount={}", e.getPoolSize(), e.getActiveCount());
          throw new RejectedExecutionException("compliance scheduler rejected task");
        });
    scheduler.initialize();

    new ExecutorServiceMetrics(
            scheduler.getScheduledExecutor(), "compliance.scheduler", Collections.emptyList())
        .bindTo(meterRegistry);
    log.info("[TaskScheduler] Initialized with poolSize={}", properties.poolSize());
    return scheduler;
  }
}
