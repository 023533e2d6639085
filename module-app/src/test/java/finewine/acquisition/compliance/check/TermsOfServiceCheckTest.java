package finewine.acquisition.compliance.check;

import static finewine.acquisition.support.TestSources.source;
import static org.assertj.core.api.Assertions.assertThat;

import finewine.acquisition.compliance.CheckReport;
import finewine.acquisition.compliance.policy.TermsOfService;
import finewine.acquisition.compliance.policy.TermsOfServiceRegistry;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.source.SourceRegistry;
import finewine.acquisition.support.StubFetcher;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TermsOfServiceCheckTest {

  private static final SourceId MLB = SourceId.of("mlb_api");
  private static final SourceId FANGRAPHS = SourceId.of("fangraphs");

  private final SourceRegistry registry =
      new SourceRegistry(
          List.of(
              source(StubFetcher.returning(MLB, "m"), 0),
              source(StubFetcher.returning(FANGRAPHS, "f"), 1)));

  @Test
  @DisplayName("수락되지 않은 약관은 CRITICAL 로 보고한다")
  void notAccepted() {
    TermsOfServiceRegistry tos =
        new TermsOfServiceRegistry(
            Map.of(
                MLB, new TermsOfService(MLB, "2024.1", true, null, null, List.of()),
                FANGRAPHS, new TermsOfService(FANGRAPHS, "2024.1", false, null, null, List.of())));

    CheckReport report = new TermsOfServiceCheck(registry, tos).run();

    assertThat(report.severity()).isEqualTo(AlertSeverity.CRITICAL);
    assertThat(report.toAlertMessage()).isEqualTo("ToS compliance issues: ToS not accepted for fangraphs");
  }

  @Test
  @DisplayName("모두 수락되어 있으면 통과")
  void passes() {
    TermsOfServiceRegistry tos =
        new TermsOfServiceRegistry(
            Map.of(
                MLB, new TermsOfService(MLB, "2024.1", true, null, null, List.of()),
                FANGRAPHS, new TermsOfService(FANGRAPHS, "2024.1", true, null, null, List.of())));

    assertThat(new TermsOfServiceCheck(registry, tos).run().hasIssues()).isFalse();
  }
}
