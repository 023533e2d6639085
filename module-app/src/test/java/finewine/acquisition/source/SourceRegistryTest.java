package finewine.acquisition.source;

import static finewine.acquisition.support.TestSources.PLAYER_STATS;
import static finewine.acquisition.support.TestSources.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import finewine.acquisition.domain.exception.SourceRegistrationException;
import finewine.acquisition.domain.exception.UnknownCapabilityException;
import finewine.acquisition.domain.exception.UnknownSourceException;
import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.RegisteredSource;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.support.StubFetcher;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SourceRegistryTest {

  private static final SourceId MLB = SourceId.of("mlb_api");
  private static final SourceId FANGRAPHS = SourceId.of("fangraphs");
  private static final SourceId STATCAST = SourceId.of("statcast");

  @Test
  @DisplayName("후보는 우선순위 오름차순, 같은 우선순위는 등록 순서를 유지한다")
  void ordersByPriorityThenRegistration() {
    SourceRegistry registry =
        new SourceRegistry(
            List.of(
                source(StubFetcher.returning(FANGRAPHS, "f"), 1),
                source(StubFetcher.returning(STATCAST, "s"), 1),
                source(StubFetcher.returning(MLB, "m"), 0)));

    assertThat(registry.forCapability(PLAYER_STATS))
        .extracting(RegisteredSource::id)
        .containsExactly(MLB, FANGRAPHS, STATCAST);
    assertThat(registry.ids()).containsExactly(MLB, FANGRAPHS, STATCAST);
    assertThat(registry.capabilities()).containsExactly(PLAYER_STATS);
  }

  @Test
  @DisplayName("같은 id 가 두 번 등록되면 기동 실패")
  void rejectsDuplicate() {
    assertThatThrownBy(
            () ->
                new SourceRegistry(
                    List.of(
                        source(StubFetcher.returning(MLB, "a"), 0),
                        source(StubFetcher.returning(MLB, "b"), 1))))
        .isInstanceOf(SourceRegistrationException.class);
  }

  @Test
  @DisplayName("fetcher 의 id 가 소스 id 와 다르면 기동 실패")
  void rejectsMismatchedFetcher() {
    RegisteredSource mlb = source(StubFetcher.returning(MLB, "m"), 0);
    RegisteredSource mismatched =
        new RegisteredSource(mlb.definition(), StubFetcher.returning(FANGRAPHS, "f"));

    assertThatThrownBy(() -> new SourceRegistry(List.of(mismatched)))
        .isInstanceOf(SourceRegistrationException.class);
  }

  @Test
  @DisplayName("모르는 소스/capability 조회는 전용 예외")
  void unknownLookups() {
    SourceRegistry registry = new SourceRegistry(List.of(source(StubFetcher.returning(MLB, "m"), 0)));

    assertThatThrownBy(() -> registry.require(FANGRAPHS)).isInstanceOf(UnknownSourceException.class);
    assertThatThrownBy(() -> registry.forCapability(Capability.of("weather")))
        .isInstanceOf(UnknownCapabilityException.class);
    assertThat(registry.contains(MLB)).isTrue();
  }
}
