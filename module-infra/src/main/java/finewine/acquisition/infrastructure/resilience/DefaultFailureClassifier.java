package finewine.acquisition.infrastructure.resilience;

import finewine.acquisition.domain.exception.ProviderResponseException;
import finewine.acquisition.domain.model.fetch.OutcomeKind;
import finewine.acquisition.error.exception.marker.CircuitBreakerIgnoreMarker;
import finewine.acquisition.error.exception.marker.CircuitBreakerRecordMarker;
import finewine.acquisition.infrastructure.util.ExceptionUtils;
import java.util.Set;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * 기본 실패 분류기.
 *
 * <ul>
 *   <li>404 → NOT_FOUND (실패 아님)
 *   <li>429 → RATE_LIMITED (실패)
 *   <li>5xx → HTTP_ERROR (실패)
 *   <li>그 외 4xx → HTTP_ERROR (실패 아님, {@code additionalFailureStatuses} 에 있으면 실패)
 *   <li>응답 상태가 없는 예외 (연결 실패, 타임아웃, I/O) → TRANSPORT_ERROR (실패)
 * </ul>
 *
 * <p>{@link CircuitBreakerIgnoreMarker} / {@link CircuitBreakerRecordMarker} 를 구현한 예외는 마커가 우선합니다.
 */
public class DefaultFailureClassifier implements FailureClassifier {

  private static final int NOT_FOUND = 404;
  private static final int TOO_MANY_REQUESTS = 429;

  private final Set<Integer> additionalFailureStatuses;

  public DefaultFailureClassifier() {
    this(Set.of());
  }

  public DefaultFailureClassifier(Set<Integer> additionalFailureStatuses) {
    this.additionalFailureStatuses = Set.copyOf(additionalFailureStatuses);
  }

  @Override
  public Classification classify(Throwable error) {
    Throwable cause = ExceptionUtils.unwrapAsyncException(error);
    String detail = ExceptionUtils.describe(cause);
    Integer status = statusOf(cause);

    if (status == null) {
      if (cause instanceof CircuitBreakerIgnoreMarker) {
        return Classification.neutral(OutcomeKind.TRANSPORT_ERROR, null, detail);
      }
      return Classification.failure(OutcomeKind.TRANSPORT_ERROR, null, detail);
    }
    OutcomeKind kind = kindOf(status);
    if (cause instanceof CircuitBreakerRecordMarker) {
      return Classification.failure(kind, status, detail);
    }
    if (cause instanceof CircuitBreakerIgnoreMarker) {
      return Classification.neutral(kind, status, detail);
    }
    boolean failure =
        status == TOO_MANY_REQUESTS || status >= 500 || additionalFailureStatuses.contains(status);
    return new Classification(kind, failure, status, detail);
  }

  private static OutcomeKind kindOf(int status) {
    if (status == NOT_FOUND) {
      return OutcomeKind.NOT_FOUND;
    }
    if (status == TOO_MANY_REQUESTS) {
      return OutcomeKind.RATE_LIMITED;
    }
    return OutcomeKind.HTTP_ERROR;
  }

  private static Integer statusOf(Throwable cause) {
    ProviderResponseException provider =
        ExceptionUtils.findCause(cause, ProviderResponseException.class);
    if (provider != null) {
      return provider.getStatusCode();
    }
    WebClientResponseException response =
        ExceptionUtils.findCause(cause, WebClientResponseException.class);
    if (response != null) {
      return response.getStatusCode().value();
    }
    return null;
  }
}
