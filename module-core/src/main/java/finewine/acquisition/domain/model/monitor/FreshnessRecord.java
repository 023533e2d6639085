package finewine.acquisition.domain.model.monitor;

import finewine.acquisition.domain.model.fetch.FetchOutcome;
import finewine.acquisition.domain.model.source.SourceId;
import java.time.Instant;

/**
 * 소스별 신선도/오류 누적 기록 (불변).
 *
 * <p>결과가 들어올 때마다 {@link #apply(FetchOutcome)} 로 새 인스턴스를 만듭니다. 성공하면 연속 실패가 0으로 초기화됩니다.
 * 제공자 응답이 없는 결과({@link finewine.acquisition.domain.model.fetch.OutcomeKind#reflectsProviderHealth()} 가
 * false)는 마지막 시도 시각만 갱신합니다.
 */
public record FreshnessRecord(
    SourceId source,
    Instant lastSuccess,
    Instant lastAttempt,
    int failureStreak,
    String lastError,
    long totalAttempts,
    long totalFailures) {

  public static FreshnessRecord empty(SourceId source) {
    return new FreshnessRecord(source, null, null, 0, null, 0, 0);
  }

  public FreshnessRecord apply(FetchOutcome outcome) {
    if (outcome.isSuccess()) {
      return new FreshnessRecord(
          source,
          outcome.timestamp(),
          outcome.timestamp(),
          0,
          lastError,
          totalAttempts + 1,
          totalFailures);
    }
    if (!outcome.kind().reflectsProviderHealth()) {
      return new FreshnessRecord(
          source,
          lastSuccess,
          outcome.timestamp(),
          failureStreak,
          lastError,
          totalAttempts,
          totalFailures);
    }
    return new FreshnessRecord(
        source,
        lastSuccess,
        outcome.timestamp(),
        failureStreak + 1,
        outcome.describe(),
        totalAttempts + 1,
        totalFailures + 1);
  }

  public boolean hasSucceeded() {
    return lastSuccess != null;
  }

  public double errorRate() {
    return totalAttempts == 0 ? 0.0 : (double) totalFailures / totalAttempts;
  }
}
