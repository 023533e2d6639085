package finewine.acquisition.monitor;

import finewine.acquisition.core.port.out.FetchOutcomeListener;
import finewine.acquisition.domain.model.fetch.FetchOutcome;
import finewine.acquisition.domain.model.source.SourceId;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 소스별 월간 요청 수 집계 (UTC 기준 월).
 *
 * <p>실제로 네트워크까지 나간 시도만 셉니다. 서킷 차단이나 비활성 스킵은 비용이 발생하지 않습니다.
 */
public class CostTracker implements FetchOutcomeListener {

  private final Map<SourceId, MonthlyCount> counts = new ConcurrentHashMap<>();
  private final Clock clock;

  public CostTracker(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void onOutcome(FetchOutcome outcome) {
    if (!outcome.kind().isDispatched()) {
      return;
    }
    YearMonth month = YearMonth.from(outcome.timestamp().atZone(ZoneOffset.UTC));
    counts.compute(
        outcome.source(),
        (source, current) -> {
          MonthlyCount count =
              current == null || !current.month().equals(month)
                  ? new MonthlyCount(month, new AtomicLong())
                  : current;
          count.requests().incrementAndGet();
          return count;
        });
  }

  public long requestsThisMonth(SourceId source) {
    MonthlyCount count = counts.get(source);
    if (count == null || !count.month().equals(currentMonth())) {
      return 0;
    }
    return count.requests().get();
  }

  public YearMonth currentMonth() {
    return YearMonth.now(clock.withZone(ZoneOffset.UTC));
  }

  private record MonthlyCount(YearMonth month, AtomicLong requests) {}
}
