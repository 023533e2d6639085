package finewine.acquisition.compliance.check;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import finewine.acquisition.compliance.CheckReport;
import finewine.acquisition.compliance.policy.RetentionPolicyRegistry;
import finewine.acquisition.core.port.out.RetentionCleaner;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.infrastructure.executor.DefaultLogicExecutor;
import finewine.acquisition.infrastructure.executor.strategy.ExceptionTranslator;
import finewine.acquisition.support.MutableClock;
import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class DataRetentionCheckTest {

  private static final Instant NOW = Instant.parse("2026-04-01T03:00:00Z");

  private RetentionCleaner cleaner;
  private DataRetentionCheck check;

  @BeforeEach
  void setUp() {
    cleaner = mock(RetentionCleaner.class);
    RetentionPolicyRegistry policies =
        RetentionPolicyRegistry.fromConfig(
            Map.of(
                "prospect_data", Map.of("raw_stats", "30", "derived_metrics", "indefinite"),
                "user_data", Map.of("logs", "90")));
    check =
        new DataRetentionCheck(
            policies,
            cleaner,
            new DefaultLogicExecutor(ExceptionTranslator.defaultTranslator()),
            new MutableClock(NOW));
  }

  @Test
  @DisplayName("기한이 있는 분류만 cutoff 를 계산해 정리한다")
  void purgesFiniteOnly() throws Exception {
    given(cleaner.purgeOlderThan(any(), any(), any())).willReturn(0L);

    CheckReport report = check.run();

    verify(cleaner)
        .purgeOlderThan("prospect_data", "raw_stats", Instant.parse("2026-03-02T03:00:00Z"));
    verify(cleaner).purgeOlderThan("user_data", "logs", Instant.parse("2026-01-01T03:00:00Z"));
    verify(cleaner, never()).purgeOlderThan(eq("prospect_data"), eq("derived_metrics"), any());
    assertThat(report.alert()).isFalse();
  }

  @Test
  @DisplayName("삭제된 레코드가 있으면 INFO 알림")
  void reportsCleaned() throws Exception {
    given(cleaner.purgeOlderThan(any(), any(), any())).willReturn(3L);

    CheckReport report = check.run();

    assertThat(report.severity()).isEqualTo(AlertSeverity.INFO);
    assertThat(report.alert()).isTrue();
    assertThat(report.summary()).isEqualTo("Data retention cleanup completed: 6 records cleaned");
  }

  @Test
  @DisplayName("한 분류가 실패해도 나머지는 정리하고 ERROR 로 보고한다")
  void isolatesFailure() throws Exception {
    given(cleaner.purgeOlderThan(eq("prospect_data"), eq("raw_stats"), any()))
        .willThrow(new IOException("disk unavailable"));
    given(cleaner.purgeOlderThan(eq("user_data"), eq("logs"), any())).willReturn(2L);

    CheckReport report = check.run();

    verify(cleaner).purgeOlderThan(eq("user_data"), eq("logs"), any());
    assertThat(report.severity()).isEqualTo(AlertSeverity.ERROR);
    assertThat(report.issues())
        .containsExactly("prospect_data.raw_stats: IOException: disk unavailable");
  }
}
