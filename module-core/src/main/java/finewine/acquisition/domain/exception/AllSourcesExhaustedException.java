package finewine.acquisition.domain.exception;

import finewine.acquisition.domain.model.fetch.OutcomeKind;
import finewine.acquisition.domain.model.fetch.SourceFailure;
import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.error.CommonErrorCode;
import finewine.acquisition.error.exception.base.ServerBaseException;
import java.util.List;
import lombok.Getter;

/** capability 의 모든 소스가 실패/차단/비활성일 때. 소스별 사유를 순서대로 보존합니다. */
@Getter
public class AllSourcesExhaustedException extends ServerBaseException {

  private final Capability capability;
  private final List<SourceFailure> failures;

  public AllSourcesExhaustedException(Capability capability, List<SourceFailure> failures) {
    super(CommonErrorCode.ALL_SOURCES_EXHAUSTED, capability.value(), List.copyOf(failures));
    this.capability = capability;
    this.failures = List.copyOf(failures);
  }

  /** 시도한 모든 소스가 "데이터 없음"으로 응답했으면 true */
  public boolean isNotFoundEverywhere() {
    List<SourceFailure> attempted = failures.stream().filter(SourceFailure::attempted).toList();
    return !attempted.isEmpty()
        && attempted.stream().allMatch(f -> f.kind() == OutcomeKind.NOT_FOUND);
  }
}
