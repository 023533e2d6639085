package finewine.acquisition.compliance.check;

import static finewine.acquisition.support.TestSources.source;
import static org.assertj.core.api.Assertions.assertThat;

import finewine.acquisition.compliance.CheckReport;
import finewine.acquisition.compliance.policy.AttributionPolicy;
import finewine.acquisition.compliance.policy.AttributionRegistry;
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
class AttributionComplianceCheckTest {

  private static final SourceId MLB = SourceId.of("mlb_api");
  private static final SourceId FANGRAPHS = SourceId.of("fangraphs");

  private final SourceRegistry registry =
      new SourceRegistry(
          List.of(
              source(StubFetcher.returning(MLB, "m"), 0),
              source(StubFetcher.returning(FANGRAPHS, "f"), 1)));

  @Test
  @DisplayName("등록된 소스에 정책이 없으면 WARNING")
  void missingPolicy() {
    AttributionRegistry attributions =
        new AttributionRegistry(
            Map.of(
                MLB,
                new AttributionPolicy(
                    MLB, true, "Data provided by MLB", "https://statsapi.mlb.com", "footer",
                    "clearly visible", false)));

    CheckReport report = new AttributionComplianceCheck(registry, attributions).run();

    assertThat(report.severity()).isEqualTo(AlertSeverity.WARNING);
    assertThat(report.issues()).containsExactly("Missing attribution policy for fangraphs");
  }

  @Test
  @DisplayName("모든 정책이 완전하면 통과")
  void passes() {
    AttributionRegistry attributions =
        new AttributionRegistry(
            Map.of(
                MLB, new AttributionPolicy(MLB, false, null, null, null, null, false),
                FANGRAPHS,
                new AttributionPolicy(
                    FANGRAPHS, true, "FanGraphs", "https://www.fangraphs.com", "footer", "visible",
                    true)));

    CheckReport report = new AttributionComplianceCheck(registry, attributions).run();

    assertThat(report.hasIssues()).isFalse();
    assertThat(report.alert()).isFalse();
  }
}
