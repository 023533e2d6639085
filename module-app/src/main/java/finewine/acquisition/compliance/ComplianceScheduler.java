package finewine.acquisition.compliance;

import finewine.acquisition.domain.exception.InvalidCheckIntervalException;
import finewine.acquisition.domain.exception.UnknownCheckException;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.compliance.CheckId;
import finewine.acquisition.infrastructure.executor.LogicExecutor;
import finewine.acquisition.infrastructure.executor.TaskContext;
import finewine.acquisition.infrastructure.util.ExceptionUtils;
import finewine.acquisition.monitor.PipelineMonitor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

/**
 * 컴플라이언스 점검 스케줄러.
 *
 * <h3>동작</h3>
 *
 * <ul>
 *   <li>tick 마다 주기가 도래한 점검을 순서대로 실행하고, 결과와 무관하게 {@code lastRun = tick 시작 시각}
 *   <li>점검 예외는 ERROR 알림으로 바꾸고 다음 점검을 계속 실행
 *   <li>같은 점검은 동시에 두 번 실행되지 않음 (실행 중이면 SKIPPED)
 *   <li>{@link #stop()} 은 플래그만 내리고, 다음 tick 경계에서 반복이 멈춤
 * </ul>
 *
 * <p>수동 실행은 스케줄과 무관하며 {@code lastRun} 을 갱신하지 않습니다.
 */
@Slf4j
public class ComplianceScheduler {

  private static final int STATUS_ALERT_LIMIT = 20;
  private static final int STATUS_HISTORY_LIMIT = 5;

  private final Map<CheckId, ScheduledCheck> checks;
  private final PipelineMonitor monitor;
  private final TaskScheduler taskScheduler;
  private final LogicExecutor executor;
  private final ComplianceHistory history;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Duration tick;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile ScheduledFuture<?> tickHandle;

  /**
   * @param intervalOverrides 점검 이름 → 주기(분). 없는 점검은 {@link ComplianceCheck#defaultInterval()}
   * @throws UnknownCheckException override 에 등록되지 않은 점검 이름이 있을 때
   */
  public ComplianceScheduler(
      List<ComplianceCheck> checks,
      Map<String, Long> intervalOverrides,
      Duration tick,
      PipelineMonitor monitor,
      TaskScheduler taskScheduler,
      LogicExecutor executor,
      ComplianceHistory history,
      MeterRegistry meterRegistry,
      Clock clock) {
    Map<CheckId, ScheduledCheck> table = new LinkedHashMap<>();
    for (ComplianceCheck check : checks) {
      Long minutes = intervalOverrides.get(check.id().value());
      Duration interval = minutes == null ? check.defaultInterval() : toInterval(check.id(), minutes);
      if (table.putIfAbsent(check.id(), new ScheduledCheck(check, interval)) != null) {
        throw new IllegalArgumentException("duplicate compliance check: " + check.id());
      }
    }
    for (String name : intervalOverrides.keySet()) {
      if (!table.containsKey(CheckId.of(name))) {
        throw new UnknownCheckException(CheckId.of(name));
      }
    }
    this.checks = Collections.unmodifiableMap(table);
    this.tick = tick;
    this.monitor = monitor;
    this.taskScheduler = taskScheduler;
    this.executor = executor;
    this.history = history;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public void start() {
    if (!running.compareAndSet(false, true)) {
      log.warn("[ComplianceScheduler] Compliance monitoring is already running");
      return;
    }
    ScheduledFuture<?> previous = tickHandle;
    if (previous != null) {
      previous.cancel(false);
    }
    tickHandle = taskScheduler.scheduleAtFixedRate(this::tick, tick);
    log.info(
        "[ComplianceScheduler] Started: tick={}, checks={}", tick, checks.keySet());
  }

  public void stop() {
    if (!running.compareAndSet(true, false)) {
      log.warn("[ComplianceScheduler] Compliance monitoring is not running");
      return;
    }
    log.info("[ComplianceScheduler] Stop requested, loop ends at next tick boundary");
  }

  public boolean isRunning() {
    return running.get();
  }

  void tick() {
    if (!running.get()) {
      ScheduledFuture<?> handle = tickHandle;
      if (handle != null) {
        handle.cancel(false);
      }
      log.info("[ComplianceScheduler] Stopped");
      return;
    }
    executor.executeOrDefault(
        this::runDueChecks, List.of(), TaskContext.of("ComplianceScheduler", "Tick"));
  }

  /** tick 한 번. 도래한 점검만 실행합니다. */
  public List<CheckRunResult> runDueChecks() {
    Instant now = clock.instant();
    List<CheckRunResult> results = new ArrayList<>();
    for (ScheduledCheck scheduled : checks.values()) {
      if (!scheduled.isDue(now)) {
        continue;
      }
      if (!scheduled.tryStart()) {
        log.info("[ComplianceScheduler] {} still running, skipped this tick", scheduled.id());
        results.add(record(scheduled, CheckRunResult.skipped(scheduled.id(), now)));
        continue;
      }
      try {
        log.info("[ComplianceScheduler] Running scheduled compliance check: {}", scheduled.id());
        scheduled.lastRun(now);
        results.add(record(scheduled, execute(scheduled.check())));
      } finally {
        scheduled.finish();
      }
    }
    return results;
  }

  /**
   * 스케줄과 무관하게 즉시 실행합니다.
   *
   * @throws UnknownCheckException 등록되지 않은 점검
   */
  public CheckRunResult runManualCheck(CheckId checkId) {
    ScheduledCheck scheduled = require(checkId);
    if (!scheduled.tryStart()) {
      log.warn("[ComplianceScheduler] Manual run of {} skipped: already running", checkId);
      return record(scheduled, CheckRunResult.skipped(checkId, clock.instant()));
    }
    try {
      log.info("[ComplianceScheduler] Running manual compliance check: {}", checkId);
      return record(scheduled, execute(scheduled.check()));
    } finally {
      scheduled.finish();
    }
  }

  /**
   * @throws UnknownCheckException 등록되지 않은 점검
   * @throws InvalidCheckIntervalException 0 이하의 주기
   */
  public void updateCheckInterval(CheckId checkId, long minutes) {
    ScheduledCheck scheduled = require(checkId);
    scheduled.interval(toInterval(checkId, minutes));
    log.info("[ComplianceScheduler] Updated interval for {} to {} minutes", checkId, minutes);
  }

  public Duration getCheckInterval(CheckId checkId) {
    return require(checkId).interval();
  }

  public MonitoringStatus getMonitoringStatus() {
    Map<String, Instant> lastRuns = new LinkedHashMap<>();
    Map<String, Long> intervals = new LinkedHashMap<>();
    Map<String, String> statuses = new LinkedHashMap<>();
    for (ScheduledCheck scheduled : checks.values()) {
      String name = scheduled.id().value();
      if (scheduled.lastRun() != null) {
        lastRuns.put(name, scheduled.lastRun());
      }
      intervals.put(name, scheduled.interval().toMinutes());
      if (scheduled.lastResult() != null) {
        statuses.put(name, scheduled.lastResult().status().value());
      }
    }
    return new MonitoringStatus(
        running.get(),
        Collections.unmodifiableMap(lastRuns),
        Collections.unmodifiableMap(intervals),
        Collections.unmodifiableMap(statuses),
        monitor.recentAlerts(STATUS_ALERT_LIMIT),
        history.size(),
        history.recent(STATUS_HISTORY_LIMIT));
  }

  private CheckRunResult execute(ComplianceCheck check) {
    Instant start = clock.instant();
    String component = "compliance:" + check.id();
    return executor.executeWithFallback(
        () -> {
          CheckReport report = check.run();
          if (report.alert()) {
            monitor.sendAlert(report.severity(), report.toAlertMessage(), component);
          } else {
            log.info("[ComplianceScheduler] {} passed: {}", check.id(), report.summary());
          }
          return new CheckRunResult(
              check.id(), CheckRunStatus.COMPLETED, start, clock.instant(), report, null);
        },
        e -> {
          String error = ExceptionUtils.describe(e);
          log.error("[ComplianceScheduler] Compliance check {} failed: {}", check.id(), error, e);
          monitor.sendAlert(
              AlertSeverity.ERROR, "Compliance check " + check.id() + " failed: " + error, component);
          return new CheckRunResult(
              check.id(), CheckRunStatus.FAILED, start, clock.instant(), null, error);
        },
        TaskContext.of("ComplianceScheduler", "RunCheck", check.id().value()));
  }

  private CheckRunResult record(ScheduledCheck scheduled, CheckRunResult result) {
    if (result.status() != CheckRunStatus.SKIPPED) {
      scheduled.lastResult(result);
    }
    Counter.builder("acquisition.compliance.runs")
        .tag("check", result.checkName().value())
        .tag("status", result.status().value())
        .register(meterRegistry)
        .increment();
    return result;
  }

  private ScheduledCheck require(CheckId checkId) {
    ScheduledCheck scheduled = checks.get(checkId);
    if (scheduled == null) {
      throw new UnknownCheckException(checkId);
    }
    return scheduled;
  }

  private static Duration toInterval(CheckId checkId, long minutes) {
    if (minutes <= 0) {
      throw new InvalidCheckIntervalException(checkId, minutes);
    }
    return Duration.ofMinutes(minutes);
  }
}
