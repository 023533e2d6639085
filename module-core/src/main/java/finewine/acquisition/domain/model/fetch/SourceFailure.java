package finewine.acquisition.domain.model.fetch;

import finewine.acquisition.domain.model.source.SourceId;

/**
 * failover 소진 시 소스별 실패 사유.
 *
 * @param attempted false 면 시도 없이 건너뜀 (비활성 또는 서킷 open)
 */
public record SourceFailure(SourceId source, OutcomeKind kind, boolean attempted, String reason) {

  public static SourceFailure skipped(SourceId source, OutcomeKind kind, String reason) {
    return new SourceFailure(source, kind, false, reason);
  }

  public static SourceFailure attempted(FetchOutcome outcome) {
    return new SourceFailure(outcome.source(), outcome.kind(), true, outcome.describe());
  }

  @Override
  public String toString() {
    return source + "=" + (attempted ? "" : "skipped:") + reason;
  }
}
