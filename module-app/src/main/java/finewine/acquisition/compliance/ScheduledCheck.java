package finewine.acquisition.compliance;

import finewine.acquisition.domain.model.compliance.CheckId;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/** 점검별 스케줄 상태. {@link ComplianceScheduler} 만 변경합니다. */
final class ScheduledCheck {

  private final ComplianceCheck check;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile Duration interval;
  private volatile Instant lastRun;
  private volatile CheckRunResult lastResult;

  ScheduledCheck(ComplianceCheck check, Duration interval) {
    this.check = check;
    this.interval = interval;
  }

  CheckId id() {
    return check.id();
  }

  ComplianceCheck check() {
    return check;
  }

  boolean isDue(Instant now) {
    Instant last = lastRun;
    return last == null || Duration.between(last, now).compareTo(interval) >= 0;
  }

  boolean tryStart() {
    return running.compareAndSet(false, true);
  }

  void finish() {
    running.set(false);
  }

  Duration interval() {
    return interval;
  }

  void interval(Duration interval) {
    this.interval = interval;
  }

  Instant lastRun() {
    return lastRun;
  }

  void lastRun(Instant lastRun) {
    this.lastRun = lastRun;
  }

  CheckRunResult lastResult() {
    return lastResult;
  }

  void lastResult(CheckRunResult lastResult) {
    this.lastResult = lastResult;
  }
}
