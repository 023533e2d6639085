package finewine.acquisition.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import finewine.acquisition.config.MonitorProperties;
import finewine.acquisition.core.port.out.AlertPublisher;
import finewine.acquisition.core.port.out.FetchOutcomeListener;
import finewine.acquisition.domain.model.alert.Alert;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.fetch.FetchOutcome;
import finewine.acquisition.domain.model.fetch.OutcomeKind;
import finewine.acquisition.domain.model.monitor.FreshnessReport;
import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.infrastructure.executor.DefaultLogicExecutor;
import finewine.acquisition.infrastructure.executor.strategy.ExceptionTranslator;
import finewine.acquisition.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class PipelineMonitorTest {

  private static final SourceId MLB = SourceId.of("mlb_api");
  private static final SourceId FANGRAPHS = SourceId.of("fangraphs");
  private static final Capability STATS = Capability.of("player_stats");

  private MutableClock clock;
  private AlertPublisher alertPublisher;
  private SimpleMeterRegistry meterRegistry;
  private List<FetchOutcome> observed;
  private PipelineMonitor monitor;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-04-01T12:00:00Z"));
    alertPublisher = mock(AlertPublisher.class);
    meterRegistry = new SimpleMeterRegistry();
    observed = new ArrayList<>();
    monitor = monitor(MonitorProperties.defaults(), observed::add);
  }

  private PipelineMonitor monitor(MonitorProperties properties, FetchOutcomeListener listener) {
    return new PipelineMonitor(
        clock,
        properties,
        alertPublisher,
        meterRegistry,
        new DefaultLogicExecutor(ExceptionTranslator.defaultTranslator()),
        List.of(listener));
  }

  private FetchOutcome failure(SourceId source, OutcomeKind kind, Integer status) {
    return FetchOutcome.failure(source, STATS, clock.instant(), kind, status, "boom");
  }

  private FetchOutcome success(SourceId source) {
    return FetchOutcome.success(source, STATS, clock.instant());
  }

  @Nested
  @DisplayName("연속 실패 알림")
  class FailureStreak {

    @Test
    @DisplayName("3회 연속 실패에서 ERROR 알림 1건, 6회째에 다시 1건")
    void alertsAtThresholdAndMultiples() {
      // when
      for (int i = 0; i < 5; i++) {
        monitor.recordOutcome(failure(MLB, OutcomeKind.HTTP_ERROR, 503));
      }

      // then
      verify(alertPublisher, times(1))
          .publish(argThat(alert -> alert.severity() == AlertSeverity.ERROR));
      assertThat(monitor.freshness(MLB).failureStreak()).isEqualTo(5);

      monitor.recordOutcome(failure(MLB, OutcomeKind.HTTP_ERROR, 503));
      verify(alertPublisher, times(2))
          .publish(argThat(alert -> alert.severity() == AlertSeverity.ERROR));
    }

    @Test
    @DisplayName("성공하면 연속 실패가 초기화되어 다시 3회가 필요하다")
    void successResetsStreak() {
      monitor.recordOutcome(failure(MLB, OutcomeKind.TRANSPORT_ERROR, null));
      monitor.recordOutcome(failure(MLB, OutcomeKind.TRANSPORT_ERROR, null));
      monitor.recordOutcome(success(MLB));
      monitor.recordOutcome(failure(MLB, OutcomeKind.TRANSPORT_ERROR, null));
      monitor.recordOutcome(failure(MLB, OutcomeKind.TRANSPORT_ERROR, null));

      verify(alertPublisher, never()).publish(any());
      assertThat(monitor.freshness(MLB).failureStreak()).isEqualTo(2);
      assertThat(monitor.freshness(MLB).totalAttempts()).isEqualTo(5);
    }

    @Test
    @DisplayName("취소, 서킷 차단, 비활성 결과는 연속 실패로 세지 않는다")
    void undispatchedOutcomesDoNotCount() {
      // when
      for (int i = 0; i < 3; i++) {
        monitor.recordOutcome(failure(MLB, OutcomeKind.CANCELLED, null));
        monitor.recordOutcome(failure(MLB, OutcomeKind.CIRCUIT_OPEN, null));
        monitor.recordOutcome(failure(MLB, OutcomeKind.SOURCE_INACTIVE, null));
      }

      // then
      verify(alertPublisher, never()).publish(any());
      assertThat(monitor.freshness(MLB).failureStreak()).isZero();
      assertThat(monitor.freshness(MLB).errorRate()).isZero();
      assertThat(monitor.freshness(MLB).lastAttempt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("연속 실패가 임계값에 머문 상태에서 취소가 와도 알림을 다시 보내지 않는다")
    void cancellationAtThresholdDoesNotRealert() {
      for (int i = 0; i < 3; i++) {
        monitor.recordOutcome(failure(MLB, OutcomeKind.HTTP_ERROR, 503));
      }

      monitor.recordOutcome(failure(MLB, OutcomeKind.CANCELLED, null));

      verify(alertPublisher, times(1))
          .publish(argThat(alert -> alert.severity() == AlertSeverity.ERROR));
      assertThat(monitor.freshness(MLB).failureStreak()).isEqualTo(3);
    }

    @Test
    @DisplayName("소스별로 따로 센다")
    void countsPerSource() {
      monitor.recordOutcome(failure(MLB, OutcomeKind.HTTP_ERROR, 500));
      monitor.recordOutcome(failure(FANGRAPHS, OutcomeKind.HTTP_ERROR, 500));
      monitor.recordOutcome(failure(MLB, OutcomeKind.HTTP_ERROR, 500));

      verify(alertPublisher, never()).publish(any());
    }
  }

  @Nested
  @DisplayName("rate limit 누적 알림")
  class RateLimitHits {

    @Test
    @DisplayName("1시간 안에 429 가 5회 쌓이면 WARNING 알림 1건")
    void warnsAtThreshold() {
      for (int i = 0; i < 5; i++) {
        monitor.recordOutcome(failure(FANGRAPHS, OutcomeKind.RATE_LIMITED, 429));
        clock.advance(Duration.ofMinutes(5));
      }

      verify(alertPublisher, times(1))
          .publish(argThat(alert -> alert.severity() == AlertSeverity.WARNING));
      assertThat(monitor.rateLimitHits(FANGRAPHS)).isEqualTo(5);
    }

    @Test
    @DisplayName("시간 창을 벗어난 429 는 세지 않는다")
    void evictsOutsideWindow() {
      for (int i = 0; i < 4; i++) {
        monitor.recordOutcome(failure(FANGRAPHS, OutcomeKind.RATE_LIMITED, 429));
      }
      clock.advance(Duration.ofMinutes(61));
      monitor.recordOutcome(failure(FANGRAPHS, OutcomeKind.RATE_LIMITED, 429));

      verify(alertPublisher, never())
          .publish(argThat(alert -> alert.severity() == AlertSeverity.WARNING));
      assertThat(monitor.rateLimitHits(FANGRAPHS)).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("신선도")
  class Freshness {

    @Test
    @DisplayName("성공 이력이 없으면 신선하지 않다")
    void neverSucceeded() {
      FreshnessReport report = monitor.checkFreshness(MLB, Duration.ofHours(1));

      assertThat(report.fresh()).isFalse();
      assertThat(report.lastSuccess()).isNull();
      assertThat(report.reason()).isEqualTo("no successful fetch recorded");
    }

    @Test
    @DisplayName("maxAge 경계까지는 신선하고 넘으면 stale")
    void ageBoundary() {
      monitor.recordOutcome(success(MLB));

      clock.advance(Duration.ofHours(1));
      assertThat(monitor.checkFreshness(MLB, Duration.ofHours(1)).fresh()).isTrue();

      clock.advance(Duration.ofSeconds(1));
      FreshnessReport stale = monitor.checkFreshness(MLB, Duration.ofHours(1));
      assertThat(stale.fresh()).isFalse();
      assertThat(stale.age()).isEqualTo(Duration.ofMinutes(60).plusSeconds(1));
    }

    @Test
    @DisplayName("기본 maxAge 는 24시간이다")
    void defaultMaxAge() {
      monitor.recordOutcome(success(MLB));
      clock.advance(Duration.ofHours(23));

      assertThat(monitor.checkFreshness(MLB).fresh()).isTrue();
      assertThat(monitor.checkFreshness(MLB).maxAge()).isEqualTo(Duration.ofHours(24));
    }

    @Test
    @DisplayName("staleSources 는 신선하지 않은 소스만 반환한다")
    void staleSources() {
      monitor.recordOutcome(success(MLB));

      assertThat(monitor.staleSources(List.of(MLB, FANGRAPHS), Duration.ofHours(1)))
          .extracting(FreshnessReport::source)
          .containsExactly(FANGRAPHS);
    }
  }

  @Nested
  @DisplayName("알림 발송")
  class Alerts {

    @Test
    @DisplayName("전달 실패는 삼키고 이력에는 남긴다")
    void swallowsDeliveryFailure() {
      willThrow(new IllegalStateException("webhook down")).given(alertPublisher).publish(any());

      assertThatCode(() -> monitor.sendAlert(AlertSeverity.CRITICAL, "disk full", "test"))
          .doesNotThrowAnyException();
      assertThat(monitor.recentAlerts(10)).extracting(Alert::message).containsExactly("disk full");
    }

    @Test
    @DisplayName("이력은 최대 크기를 넘지 않고 최신 알림이 마지막에 온다")
    void boundedHistory() {
      PipelineMonitor small =
          monitor(
              new MonitorProperties(3, 5, Duration.ofHours(1), 2, Duration.ofHours(24)),
              outcome -> {});

      small.sendAlert(AlertSeverity.INFO, "first", "test");
      small.sendAlert(AlertSeverity.INFO, "second", "test");
      small.sendAlert(AlertSeverity.INFO, "third", "test");

      assertThat(small.recentAlerts(10)).extracting(Alert::message).containsExactly("second", "third");
      assertThat(small.recentAlerts(1)).extracting(Alert::message).containsExactly("third");
    }

    @Test
    @DisplayName("알림 건수는 severity 태그로 집계된다")
    void countsBySeverity() {
      monitor.sendAlert(AlertSeverity.WARNING, "slow", "test", MLB);

      assertThat(
              meterRegistry.get("acquisition.alerts").tag("severity", "WARNING").counter().count())
          .isEqualTo(1.0);
      verify(alertPublisher)
          .publish(argThat(alert -> MLB.equals(alert.source()) && alert.component().equals("test")));
    }
  }

  @Nested
  @DisplayName("결과 리스너")
  class Listeners {

    @Test
    @DisplayName("모든 결과가 리스너에 전달된다")
    void notifiesListener() {
      monitor.recordOutcome(success(MLB));
      monitor.recordOutcome(failure(MLB, OutcomeKind.NOT_FOUND, 404));

      assertThat(observed).extracting(FetchOutcome::kind)
          .containsExactly(OutcomeKind.SUCCESS, OutcomeKind.NOT_FOUND);
    }

    @Test
    @DisplayName("리스너 예외는 기록을 방해하지 않는다")
    void listenerFailureIsIsolated() {
      PipelineMonitor failing =
          monitor(
              MonitorProperties.defaults(),
              outcome -> {
                throw new IllegalStateException("listener broken");
              });

      assertThatCode(() -> failing.recordOutcome(success(MLB))).doesNotThrowAnyException();
      assertThat(failing.lastSuccess(MLB)).contains(clock.instant());
      assertThat(
              meterRegistry
                  .get("acquisition.fetch.outcomes")
                  .tags("source", "mlb_api", "kind", "SUCCESS")
                  .counter()
                  .count())
          .isEqualTo(1.0);
    }
  }
}
