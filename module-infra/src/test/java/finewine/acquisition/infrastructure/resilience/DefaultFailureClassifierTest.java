package finewine.acquisition.infrastructure.resilience;

import static org.assertj.core.api.Assertions.assertThat;

import finewine.acquisition.domain.exception.CircuitOpenException;
import finewine.acquisition.domain.exception.ProviderResponseException;
import finewine.acquisition.domain.model.fetch.OutcomeKind;
import finewine.acquisition.domain.model.source.SourceId;
import java.net.ConnectException;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;

@Tag("unit")
class DefaultFailureClassifierTest {

  private static final SourceId SOURCE = SourceId.of("mlb_api");

  private final DefaultFailureClassifier classifier = new DefaultFailureClassifier();

  @ParameterizedTest(name = "{0} → {1}, failure={2}")
  @CsvSource({
    "404, NOT_FOUND, false",
    "429, RATE_LIMITED, true",
    "500, HTTP_ERROR, true",
    "503, HTTP_ERROR, true",
    "400, HTTP_ERROR, false",
    "403, HTTP_ERROR, false"
  })
  @DisplayName("HTTP 상태별 분류")
  void byStatus(int status, OutcomeKind kind, boolean failure) {
    Classification classification =
        classifier.classify(new ProviderResponseException(SOURCE, status));

    assertThat(classification.kind()).isEqualTo(kind);
    assertThat(classification.countsAsFailure()).isEqualTo(failure);
    assertThat(classification.httpStatus()).isEqualTo(status);
  }

  @Test
  @DisplayName("응답 없는 전송 오류와 타임아웃은 TRANSPORT_ERROR 실패")
  void transportErrors() {
    assertThat(classifier.classify(new ConnectException("refused")))
        .isEqualTo(Classification.failure(OutcomeKind.TRANSPORT_ERROR, null, "ConnectException: refused"));
    assertThat(classifier.classify(new TimeoutException()).countsAsFailure()).isTrue();
  }

  @Test
  @DisplayName("WebClientResponseException 의 상태 코드도 인식한다")
  void webClientResponse() {
    WebClientResponseException exception =
        WebClientResponseException.create(
            HttpStatus.TOO_MANY_REQUESTS.value(), "Too Many Requests", null, null, null);

    assertThat(classifier.classify(exception).kind()).isEqualTo(OutcomeKind.RATE_LIMITED);
  }

  @Test
  @DisplayName("추가 실패 상태로 지정한 4xx 는 실패로 센다")
  void additionalStatuses() {
    DefaultFailureClassifier strict = new DefaultFailureClassifier(Set.of(403));

    assertThat(strict.classify(new ProviderResponseException(SOURCE, 403)).countsAsFailure())
        .isTrue();
  }

  @Test
  @DisplayName("무시 마커가 붙은 예외는 실패로 세지 않는다")
  void ignoreMarker() {
    assertThat(classifier.classify(new CircuitOpenException(SOURCE)).countsAsFailure()).isFalse();
  }
}
