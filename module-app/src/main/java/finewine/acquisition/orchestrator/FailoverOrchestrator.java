package finewine.acquisition.orchestrator;

import finewine.acquisition.domain.exception.AllSourcesExhaustedException;
import finewine.acquisition.domain.exception.FetchCancelledException;
import finewine.acquisition.domain.exception.UnknownCapabilityException;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.fetch.FetchOutcome;
import finewine.acquisition.domain.model.fetch.FetchRequest;
import finewine.acquisition.domain.model.fetch.FetchResult;
import finewine.acquisition.domain.model.fetch.OutcomeKind;
import finewine.acquisition.domain.model.fetch.SourceFailure;
import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.RegisteredSource;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.infrastructure.ratelimit.SourceRateLimiter;
import finewine.acquisition.infrastructure.resilience.Classification;
import finewine.acquisition.infrastructure.resilience.Permit;
import finewine.acquisition.infrastructure.resilience.SourceCircuitBreaker;
import finewine.acquisition.infrastructure.util.ExceptionUtils;
import finewine.acquisition.monitor.PipelineMonitor;
import finewine.acquisition.source.SourceRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * capability 단위 failover 수집기.
 *
 * <h3>소스별 처리 순서 (우선순위 오름차순)</h3>
 *
 * <ol>
 *   <li>비활성 → 건너뜀 (결과 기록 없음)
 *   <li>서킷 open → 건너뜀 (결과 기록 없음)
 *   <li>rate limiter 대기 → 브레이커 permit 획득 (경합으로 거절되면 CIRCUIT_OPEN 기록)
 *   <li>fetch 실행: 소스별 attempt timeout 은 {@link TimeLimiter} 로 제한
 *   <li>결과 분류 → 브레이커 반영 → {@link PipelineMonitor} 에 기록
 * </ol>
 *
 * <p>첫 성공에서 즉시 반환하며, 모두 실패하면 {@link AllSourcesExhaustedException} 을 던집니다.
 *
 * <h3>취소</h3>
 *
 * <p>호출자 deadline 이 attempt timeout 보다 먼저 끝나거나 스레드가 인터럽트되면 진행 중 시도를 버리고 permit 을 기록 없이
 * 반납합니다. CANCELLED 결과를 남긴 뒤 {@link FetchCancelledException} 을 던집니다. attempt timeout 자체는 제공자 지연이므로
 * TRANSPORT_ERROR 로 브레이커에 반영됩니다.
 */
@Slf4j
public class FailoverOrchestrator {

  private final SourceRegistry registry;
  private final SourceRateLimiter rateLimiter;
  private final SourceCircuitBreaker circuitBreaker;
  private final PipelineMonitor monitor;
  private final Executor fetchExecutor;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final Duration defaultDeadline;
  private final Map<SourceId, TimeLimiter> timeLimiters = new ConcurrentHashMap<>();

  public FailoverOrchestrator(
      SourceRegistry registry,
      SourceRateLimiter rateLimiter,
      SourceCircuitBreaker circuitBreaker,
      PipelineMonitor monitor,
      Executor fetchExecutor,
      Clock clock,
      MeterRegistry meterRegistry,
      Duration defaultDeadline) {
    this.registry = registry;
    this.rateLimiter = rateLimiter;
    this.circuitBreaker = circuitBreaker;
    this.monitor = monitor;
    this.fetchExecutor = fetchExecutor;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.defaultDeadline = defaultDeadline;
    registerMissing();
  }

  public FetchResult fetch(Capability capability, FetchRequest request) {
    return fetch(capability, request, defaultDeadline);
  }

  /**
   * @throws UnknownCapabilityException capability 를 가진 소스가 없을 때
   * @throws AllSourcesExhaustedException 모든 소스가 실패/차단/비활성일 때
   * @throws FetchCancelledException deadline 초과 또는 인터럽트
   */
  public FetchResult fetch(Capability capability, FetchRequest request, Duration deadline) {
    List<RegisteredSource> candidates = registry.forCapability(capability);
    long deadlineNanos = System.nanoTime() + deadline.toNanos();
    List<FetchOutcome> attempts = new ArrayList<>();
    List<SourceFailure> failures = new ArrayList<>();

    for (RegisteredSource source : candidates) {
      if (!failures.isEmpty()) {
        failoverCounter(capability).increment();
      }
      Optional<SourceFailure> skipped = precheck(source);
      if (skipped.isPresent()) {
        log.debug("[Failover:{}] Skipping {}: {}", capability, source.id(), skipped.get().reason());
        failures.add(skipped.get());
        continue;
      }

      Attempt attempt = attempt(source, capability, request, deadlineNanos);
      attempts.add(attempt.outcome());
      if (attempt.outcome().isSuccess()) {
        return new FetchResult(capability, source.id(), attempt.payload(), attempts);
      }
      log.warn(
          "[Failover:{}] {} failed: {}", capability, source.id(), attempt.outcome().describe());
      failures.add(attempt.failure());
    }

    AllSourcesExhaustedException exhausted = new AllSourcesExhaustedException(capability, failures);
    if (!exhausted.isNotFoundEverywhere()) {
      monitor.sendAlert(
          AlertSeverity.ERROR,
          "All sources exhausted for " + capability + ": " + failures,
          "FailoverOrchestrator");
    }
    throw exhausted;
  }

  private Optional<SourceFailure> precheck(RegisteredSource source) {
    if (!source.definition().active()) {
      return Optional.of(
          SourceFailure.skipped(source.id(), OutcomeKind.SOURCE_INACTIVE, "source inactive"));
    }
    if (circuitBreaker.isOpen(source.id())) {
      return Optional.of(
          SourceFailure.skipped(source.id(), OutcomeKind.CIRCUIT_OPEN, "circuit open"));
    }
    return Optional.empty();
  }

  private Attempt attempt(
      RegisteredSource source, Capability capability, FetchRequest request, long deadlineNanos) {
    SourceId id = source.id();
    try {
      rateLimiter.awaitPermit(id);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw cancel(capability, id, e);
    }

    long remainingNanos = deadlineNanos - System.nanoTime();
    if (remainingNanos <= 0) {
      throw cancel(capability, id, new TimeoutException("deadline exceeded before dispatch"));
    }

    Optional<Permit> acquired = circuitBreaker.tryAcquirePermission(id);
    if (acquired.isEmpty()) {
      FetchOutcome rejected =
          record(id, capability, OutcomeKind.CIRCUIT_OPEN, null, "permission rejected");
      return Attempt.failed(
          rejected, SourceFailure.skipped(id, OutcomeKind.CIRCUIT_OPEN, "permission rejected"));
    }

    Permit permit = acquired.get();
    boolean settled = false;
    FutureTask<Object> task = null;
    Duration attemptTimeout = source.definition().attemptTimeout();
    boolean deadlineBound = remainingNanos < attemptTimeout.toNanos();
    try {
      task = new FutureTask<>(() -> source.fetcher().fetch(capability, request));
      fetchExecutor.execute(task);
      FutureTask<Object> running = task;
      Object payload =
          timeLimiter(id, attemptTimeout, deadlineBound, remainingNanos)
              .executeFutureSupplier(() -> running);
      circuitBreaker.onSuccess(permit);
      settled = true;
      FetchOutcome outcome = record(FetchOutcome.success(id, capability, clock.instant()));
      return Attempt.succeeded(outcome, payload);
    } catch (InterruptedException e) {
      abandon(task, permit);
      settled = true;
      Thread.currentThread().interrupt();
      throw cancel(capability, id, e);
    } catch (TimeoutException e) {
      if (deadlineBound) {
        abandon(task, permit);
        settled = true;
        throw cancel(capability, id, e);
      }
      settled = true;
      return classified(permit, capability, e);
    } catch (RejectedExecutionException e) {
      circuitBreaker.releasePermission(permit);
      settled = true;
      log.warn("[Failover:{}] Fetch executor rejected task for {}", capability, id);
      FetchOutcome outcome =
          record(id, capability, OutcomeKind.TRANSPORT_ERROR, null, "fetch executor saturated");
      return Attempt.failed(outcome, SourceFailure.attempted(outcome));
    } catch (Exception e) {
      settled = true;
      return classified(permit, capability, ExceptionUtils.unwrapAsyncException(e));
    } finally {
      if (!settled) {
        circuitBreaker.releasePermission(permit);
      }
    }
  }

  private Attempt classified(Permit permit, Capability capability, Throwable error) {
    Classification classification = circuitBreaker.onFailure(permit, error);
    FetchOutcome outcome =
        record(
            permit.source(),
            capability,
            classification.kind(),
            classification.httpStatus(),
            classification.detail());
    return Attempt.failed(outcome, SourceFailure.attempted(outcome));
  }

  private void abandon(FutureTask<Object> task, Permit permit) {
    if (task != null) {
      task.cancel(true);
    }
    circuitBreaker.releasePermission(permit);
  }

  private FetchCancelledException cancel(Capability capability, SourceId source, Throwable cause) {
    record(source, capability, OutcomeKind.CANCELLED, null, ExceptionUtils.describe(cause));
    log.info("[Failover:{}] Fetch cancelled while attempting {}", capability, source);
    return new FetchCancelledException(capability, source, cause);
  }

  private FetchOutcome record(
      SourceId source, Capability capability, OutcomeKind kind, Integer status, String detail) {
    return record(FetchOutcome.failure(source, capability, clock.instant(), kind, status, detail));
  }

  private FetchOutcome record(FetchOutcome outcome) {
    monitor.recordOutcome(outcome);
    return outcome;
  }

  private TimeLimiter timeLimiter(
      SourceId source, Duration attemptTimeout, boolean deadlineBound, long remainingNanos) {
    if (deadlineBound) {
      return TimeLimiter.of(limiterConfig(Duration.ofNanos(remainingNanos)));
    }
    return timeLimiters.computeIfAbsent(
        source, id -> TimeLimiter.of("source:" + id, limiterConfig(attemptTimeout)));
  }

  private static TimeLimiterConfig limiterConfig(Duration timeout) {
    return TimeLimiterConfig.custom().timeoutDuration(timeout).cancelRunningFuture(true).build();
  }

  private Counter failoverCounter(Capability capability) {
    return Counter.builder("acquisition.fetch.failovers")
        .tag("capability", capability.value())
        .register(meterRegistry);
  }

  private void registerMissing() {
    for (RegisteredSource source : registry.all()) {
      if (!rateLimiter.isRegistered(source.id())) {
        rateLimiter.register(source.id(), source.definition().rateLimit());
      }
      if (!circuitBreaker.isRegistered(source.id())) {
        circuitBreaker.register(source.id(), source.definition().circuitBreaker());
      }
    }
  }

  private record Attempt(FetchOutcome outcome, Object payload, SourceFailure failure) {

    static Attempt succeeded(FetchOutcome outcome, Object payload) {
      return new Attempt(outcome, payload, null);
    }

    static Attempt failed(FetchOutcome outcome, SourceFailure failure) {
      return new Attempt(outcome, null, failure);
    }
  }
}
