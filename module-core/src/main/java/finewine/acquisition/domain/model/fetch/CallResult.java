package finewine.acquisition.domain.model.fetch;

import java.util.Objects;

/**
 * 브레이커를 거친 호출의 태그드 결과.
 *
 * <p>예외 대신 {@link OutcomeKind} 로 흐름을 표현합니다. 실패 시 원래 예외는 {@link #error()} 로 보존됩니다.
 */
public record CallResult<T>(OutcomeKind kind, T value, Throwable error, Integer httpStatus) {

  public CallResult {
    Objects.requireNonNull(kind, "kind");
  }

  public static <T> CallResult<T> success(T value) {
    return new CallResult<>(OutcomeKind.SUCCESS, value, null, null);
  }

  public static <T> CallResult<T> rejected() {
    return new CallResult<>(OutcomeKind.CIRCUIT_OPEN, null, null, null);
  }

  public static <T> CallResult<T> failure(OutcomeKind kind, Throwable error, Integer httpStatus) {
    return new CallResult<>(kind, null, error, httpStatus);
  }

  public static <T> CallResult<T> cancelled(Throwable error) {
    return new CallResult<>(OutcomeKind.CANCELLED, null, error, null);
  }

  public boolean isSuccess() {
    return kind.isSuccess();
  }

  public boolean isRejected() {
    return kind == OutcomeKind.CIRCUIT_OPEN;
  }
}
