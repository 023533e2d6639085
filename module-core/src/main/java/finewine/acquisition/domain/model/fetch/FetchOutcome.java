package finewine.acquisition.domain.model.fetch;

import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.SourceId;
import java.time.Instant;
import java.util.Objects;

/** 시도 1회의 불변 기록. 오케스트레이터가 만들고 모니터가 소비합니다. */
public record FetchOutcome(
    SourceId source,
    Capability capability,
    Instant timestamp,
    OutcomeKind kind,
    Integer httpStatus,
    String detail) {

  public FetchOutcome {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(capability, "capability");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(kind, "kind");
  }

  public static FetchOutcome success(SourceId source, Capability capability, Instant at) {
    return new FetchOutcome(source, capability, at, OutcomeKind.SUCCESS, null, null);
  }

  public static FetchOutcome failure(
      SourceId source,
      Capability capability,
      Instant at,
      OutcomeKind kind,
      Integer httpStatus,
      String detail) {
    return new FetchOutcome(source, capability, at, kind, httpStatus, detail);
  }

  public boolean isSuccess() {
    return kind.isSuccess();
  }

  /** 로그/알림용 요약. 예: {@code HTTP_ERROR(503): Service Unavailable} */
  public String describe() {
    StringBuilder sb = new StringBuilder(kind.name());
    if (httpStatus != null) {
      sb.append('(').append(httpStatus).append(')');
    }
    if (detail != null && !detail.isBlank()) {
      sb.append(": ").append(detail);
    }
    return sb.toString();
  }
}
