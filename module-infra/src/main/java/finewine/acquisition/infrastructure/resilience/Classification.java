package finewine.acquisition.infrastructure.resilience;

import finewine.acquisition.domain.model.fetch.OutcomeKind;

/**
 * 실패 분류 결과.
 *
 * @param countsAsFailure true 면 브레이커 실패 카운트에 반영
 * @param httpStatus 응답 상태가 있으면 그 값, 없으면 null
 */
public record Classification(
    OutcomeKind kind, boolean countsAsFailure, Integer httpStatus, String detail) {

  public static Classification failure(OutcomeKind kind, Integer httpStatus, String detail) {
    return new Classification(kind, true, httpStatus, detail);
  }

  public static Classification neutral(OutcomeKind kind, Integer httpStatus, String detail) {
    return new Classification(kind, false, httpStatus, detail);
  }
}
