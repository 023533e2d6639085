package finewine.acquisition.domain.exception;

import static org.assertj.core.api.Assertions.assertThat;

import finewine.acquisition.domain.model.fetch.OutcomeKind;
import finewine.acquisition.domain.model.fetch.SourceFailure;
import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.error.CommonErrorCode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class AllSourcesExhaustedExceptionTest {

  private static final Capability STATS = Capability.of("player_stats");

  @Test
  @DisplayName("소스별 실패 사유가 메시지와 목록에 모두 남는다")
  void carriesFailures() {
    List<SourceFailure> failures =
        List.of(
            SourceFailure.skipped(SourceId.of("mlb_api"), OutcomeKind.CIRCUIT_OPEN, "circuit open"),
            new SourceFailure(SourceId.of("fangraphs"), OutcomeKind.HTTP_ERROR, true, "HTTP_ERROR(500)"));

    AllSourcesExhaustedException exception = new AllSourcesExhaustedException(STATS, failures);

    assertThat(exception.getErrorCode()).isEqualTo(CommonErrorCode.ALL_SOURCES_EXHAUSTED);
    assertThat(exception.getFailures()).hasSize(2);
    assertThat(exception.getMessage()).contains("player_stats", "mlb_api", "fangraphs");
    assertThat(exception.isNotFoundEverywhere()).isFalse();
  }

  @Test
  @DisplayName("시도한 소스가 모두 NOT_FOUND 면 데이터 없음으로 판정")
  void notFoundEverywhere() {
    List<SourceFailure> failures =
        List.of(
            new SourceFailure(SourceId.of("mlb_api"), OutcomeKind.NOT_FOUND, true, "NOT_FOUND(404)"),
            SourceFailure.skipped(SourceId.of("fangraphs"), OutcomeKind.SOURCE_INACTIVE, "inactive"));

    assertThat(new AllSourcesExhaustedException(STATS, failures).isNotFoundEverywhere()).isTrue();
  }
}
