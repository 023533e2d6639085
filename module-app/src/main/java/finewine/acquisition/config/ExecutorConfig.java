package finewine.acquisition.config;

import finewine.acquisition.infrastructure.executor.DefaultLogicExecutor;
import finewine.acquisition.infrastructure.executor.LogicExecutor;
import finewine.acquisition.infrastructure.executor.strategy.ExceptionTranslator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.Collections;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 실행기 설정.
 *
 * <h3>Beans</h3>
 *
 * <ul>
 *   <li><b>logicExecutor</b>: try/catch 템플릿 ({@link DefaultLogicExecutor})
 *   <li><b>fetchExecutor</b>: 소스 fetch 함수를 실행하는 bounded 풀 ("fetch-")
 * </ul>
 *
 * <h3>fetchExecutor 거절 정책</h3>
 *
 * <p>큐가 가득 차면 즉시 거절하고 {@code fetch.executor.rejected} 를 올립니다. 오케스트레이터는 거절을 TRANSPORT_ERROR 로
 * 기록하고 다음 소스로 넘어갑니다 (브레이커에는 반영하지 않음).
 */
@Slf4j
@Configuration
public class ExecutorConfig {

  @Bean
  public ExceptionTranslator exceptionTranslator() {
    return ExceptionTranslator.defaultTranslator();
  }

  @Bean
  @ConditionalOnMissingBean(LogicExecutor.class)
  public LogicExecutor logicExecutor(ExceptionTranslator translator) {
    return new DefaultLogicExecutor(translator);
  }

  @Bean(name = "fetchExecutor")
  public ThreadPoolTaskExecutor fetchExecutor(
      AcquisitionProperties properties, MeterRegistry meterRegistry) {
    AcquisitionProperties.FetchProperties fetch = properties.fetch();
    Counter rejected =
        Counter.builder("fetch.executor.rejected")
            .description("Number of fetch tasks rejected due to queue full")
            .register(meterRegistry);

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(fetch.poolSize());
    executor.setMaxPoolSize(fetch.poolSize());
    executor.setQueueCapacity(fetch.queueCapacity());
    executor.setThreadNamePrefix("fetch-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.setRejectedExecutionHandler(
        (r, e) -> {
          rejected.increment();
          throw new RejectedExecutionException("fetch executor queue full");
        });
    executor.initialize();

    new ExecutorServiceMetrics(
            executor.getThreadPoolExecutor(), "fetch.executor", Collections.emptyList())
        .bindTo(meterRegistry);
    log.info(
        "[FetchExecutor] Initialized with poolSize={}, queueCapacity={}",
        fetch.poolSize(),
        fetch.queueCapacity());
    return executor;
  }
}
