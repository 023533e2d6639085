package finewine.acquisition.compliance.check;

import static finewine.acquisition.support.TestSources.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import finewine.acquisition.compliance.CheckReport;
import finewine.acquisition.compliance.policy.CostPolicy;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.fetch.FetchOutcome;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.monitor.CostTracker;
import finewine.acquisition.source.SourceRegistry;
import finewine.acquisition.support.MutableClock;
import finewine.acquisition.support.StubFetcher;
import finewine.acquisition.support.TestSources;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class CostMonitoringCheckTest {

  private static final SourceId MLB = SourceId.of("mlb_api");
  private static final SourceId STATCAST = SourceId.of("statcast");

  private final MutableClock clock = new MutableClock(Instant.parse("2026-04-10T00:00:00Z"));
  private final CostTracker costTracker = new CostTracker(clock);
  private final SourceRegistry registry =
      new SourceRegistry(
          List.of(
              source(StubFetcher.returning(MLB, "m"), 0),
              source(StubFetcher.returning(STATCAST, "s"), 1)));

  private void dispatch(SourceId source, int times) {
    for (int i = 0; i < times; i++) {
      costTracker.onOutcome(FetchOutcome.success(source, TestSources.PLAYER_STATS, clock.instant()));
    }
  }

  @Test
  @DisplayName("월 한도의 80% 를 넘으면 WARNING")
  void approachingLimit() {
    dispatch(STATCAST, 9);
    CostMonitoringCheck check =
        new CostMonitoringCheck(
            registry,
            costTracker,
            Map.of(STATCAST, new CostPolicy(STATCAST, BigDecimal.ZERO, 10L, false)),
            0.8);

    CheckReport report = check.run();

    assertThat(report.severity()).isEqualTo(AlertSeverity.WARNING);
    assertThat(report.issues()).containsExactly("statcast approaching usage limit: 9/10");
  }

  @Test
  @DisplayName("무료 소스에 비용이 발생하면 보고한다")
  void unexpectedCost() {
    dispatch(MLB, 4);
    CostMonitoringCheck check =
        new CostMonitoringCheck(
            registry,
            costTracker,
            Map.of(MLB, new CostPolicy(MLB, new BigDecimal("0.25"), null, true)),
            0.8);

    assertThat(check.run().issues()).containsExactly("Unexpected cost for mlb_api: $1.00");
  }

  @Test
  @DisplayName("정책이 없는 소스는 무료로 보고 한도 점검을 하지 않는다")
  void missingPolicyIsFree() {
    dispatch(MLB, 1_000);

    CheckReport report = new CostMonitoringCheck(registry, costTracker, Map.of(), 0.8).run();

    assertThat(report.hasIssues()).isFalse();
  }

  @Test
  @DisplayName("alertRatio 는 (0, 1] 범위여야 한다")
  void validatesRatio() {
    assertThatThrownBy(() -> new CostMonitoringCheck(registry, costTracker, Map.of(), 1.5))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
