package finewine.acquisition.infrastructure.ratelimit;

import finewine.acquisition.domain.exception.UnknownSourceException;
import finewine.acquisition.domain.model.source.RateLimitSpec;
import finewine.acquisition.domain.model.source.SourceId;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * 소스별 최소 호출 간격 리미터.
 *
 * <h3>동작 방식</h3>
 *
 * <p>소스마다 공정(fair) 락 하나가 "마지막 허가 시각 조회 → 대기 시간 계산 → sleep → 허가 기록" 전체를 감쌉니다.
 *
 * <ul>
 *   <li>대기자는 도착 순서(FIFO)대로 풀려납니다.
 *   <li>같은 소스의 연속된 두 허가는 {@code period / maxCalls} 보다 가깝지 않습니다.
 *   <li>다른 소스끼리는 서로 막지 않습니다.
 * </ul>
 *
 * <p>허가 기록(최근 허가 시각, 누적 통계)은 불변 사본으로 게시되므로 조회 API는 간격 락을 기다리지 않습니다.
 *
 * <p>간격 계산은 단조 시계({@link System#nanoTime()})로 하고, 상태 조회용 벽시계 시각은 {@link Clock} 에서 가져옵니다.
 */
@Slf4j
public class SourceRateLimiter {

  static final int MIN_HISTORY_SIZE = 64;

  private static final String WAIT_TIMER = "acquisition.ratelimit.wait";

  private final Map<SourceId, LimiterState> states = new ConcurrentHashMap<>();
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public SourceRateLimiter(Clock clock, MeterRegistry meterRegistry) {
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  /** 소스를 등록합니다. 이미 등록된 소스면 기존 상태를 유지합니다. */
  public void register(SourceId source, RateLimitSpec spec) {
    LimiterState existing = states.putIfAbsent(source, new LimiterState(spec, waitTimer(source)));
    if (existing != null) {
      log.debug("[RateLimiter:{}] 이미 등록된 소스", source);
    }
  }

  /**
   * 다음 호출이 허용될 때까지 현재 스레드를 블로킹합니다.
   *
   * @throws InterruptedException 대기 중 인터럽트 (호출 측은 취소로 처리)
   * @throws UnknownSourceException 등록되지 않은 소스
   */
  public void awaitPermit(SourceId source) throws InterruptedException {
    LimiterState state = require(source);
    state.lock.lockInterruptibly();
    try {
      long waited = state.sleepUntilNextSlot();
      state.recordDispatch(clock.instant(), waited);
      if (waited > 0 && log.isDebugEnabled()) {
        log.debug("[RateLimiter:{}] {}ms 대기 후 허가", source, TimeUnit.NANOSECONDS.toMillis(waited));
      }
    } finally {
      state.lock.unlock();
    }
  }

  public Optional<Instant> lastDispatch(SourceId source) {
    return Optional.ofNullable(require(source).view.lastDispatchAt());
  }

  /** 간격 락을 잡지 않으므로 대기 중인 호출자가 있어도 바로 반환합니다. */
  public List<Instant> recentDispatches(SourceId source) {
    return require(source).view.history();
  }

  public RateLimiterSnapshot snapshot(SourceId source) {
    LimiterState state = require(source);
    DispatchView view = state.view;
    return new RateLimiterSnapshot(
        source,
        state.spec,
        view.lastDispatchAt(),
        view.totalPermits(),
        Duration.ofNanos(view.totalWaitNanos()),
        view.history());
  }

  public RateLimitSpec spec(SourceId source) {
    return require(source).spec;
  }

  int historySize(SourceId source) {
    return require(source).historySize();
  }

  public boolean isRegistered(SourceId source) {
    return states.containsKey(source);
  }

  private LimiterState require(SourceId source) {
    LimiterState state = states.get(source);
    if (state == null) {
      throw new UnknownSourceException(source);
    }
    return state;
  }

  private Timer waitTimer(SourceId source) {
    return Timer.builder(WAIT_TIMER)
        .description("Time spent waiting for a rate limiter permit")
        .tag("source", source.value())
        .register(meterRegistry);
  }

  /** 허가 기록의 불변 사본. 간격 락 안에서만 교체됩니다. */
  private record DispatchView(
      Instant lastDispatchAt, long totalPermits, long totalWaitNanos, List<Instant> history) {

    static final DispatchView EMPTY = new DispatchView(null, 0L, 0L, List.of());
  }

  private static final class LimiterState {
    private final ReentrantLock lock = new ReentrantLock(true);
    private final RateLimitSpec spec;
    private final long spacingNanos;
    private final Timer waitTimer;
    private final int historySize;
    private final Deque<Instant> history;

    private boolean dispatched;
    private long lastDispatchNanos;
    private volatile DispatchView view = DispatchView.EMPTY;

    private LimiterState(RateLimitSpec spec, Timer waitTimer) {
      this.spec = spec;
      this.spacingNanos = spec.minSpacing().toNanos();
      this.waitTimer = waitTimer;
      // 한 period 안의 maxCalls 초과 여부를 판정하려면 최소 maxCalls + 1 건이 필요
      this.historySize = Math.max(MIN_HISTORY_SIZE, spec.maxCalls() + 1);
      this.history = new ArrayDeque<>(historySize);
    }

    /** 락을 쥔 상태에서만 호출. 실제로 대기한 나노초를 반환합니다. */
    private long sleepUntilNextSlot() throws InterruptedException {
      long start = System.nanoTime();
      if (!dispatched) {
        return 0L;
      }
      long target = lastDispatchNanos + spacingNanos;
      long remaining;
      while ((remaining = target - System.nanoTime()) > 0) {
        TimeUnit.NANOSECONDS.sleep(remaining);
      }
      return System.nanoTime() - start;
    }

    private void recordDispatch(Instant at, long waitedNanos) {
      dispatched = true;
      lastDispatchNanos = System.nanoTime();
      if (history.size() == historySize) {
        history.removeFirst();
      }
      history.addLast(at);
      DispatchView previous = view;
      view =
          new DispatchView(
              at,
              previous.totalPermits() + 1,
              previous.totalWaitNanos() + waitedNanos,
              List.copyOf(history));
      waitTimer.record(waitedNanos, TimeUnit.NANOSECONDS);
    }

    int historySize() {
      return historySize;
    }
  }
}
