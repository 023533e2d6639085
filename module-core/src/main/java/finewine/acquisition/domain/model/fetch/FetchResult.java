package finewine.acquisition.domain.model.fetch;

import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.SourceId;
import java.util.List;

/**
 * 성공한 failover 호출의 결과.
 *
 * @param source 실제로 응답한 소스
 * @param attempts 이번 호출에서 발생한 모든 시도 기록 (마지막이 성공)
 */
public record FetchResult(
    Capability capability, SourceId source, Object payload, List<FetchOutcome> attempts) {

  public FetchResult {
    attempts = List.copyOf(attempts);
  }

  public <T> T payloadAs(Class<T> type) {
    return type.cast(payload);
  }
}
