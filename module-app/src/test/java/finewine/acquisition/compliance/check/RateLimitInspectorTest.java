package finewine.acquisition.compliance.check;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import finewine.acquisition.compliance.policy.TermsOfService;
import finewine.acquisition.compliance.policy.TermsOfServiceRegistry;
import finewine.acquisition.domain.model.source.RateLimitSpec;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.infrastructure.ratelimit.SourceRateLimiter;
import finewine.acquisition.monitor.PipelineMonitor;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class RateLimitInspectorTest {

  private static final SourceId FANGRAPHS = SourceId.of("fangraphs");
  private static final Instant T0 = Instant.parse("2026-04-01T00:00:00Z");

  private SourceRateLimiter rateLimiter;
  private PipelineMonitor monitor;

  @BeforeEach
  void setUp() {
    rateLimiter = mock(SourceRateLimiter.class);
    monitor = mock(PipelineMonitor.class);
    given(rateLimiter.recentDispatches(FANGRAPHS)).willReturn(List.of());
  }

  private RateLimitInspector inspector(TermsOfService tos) {
    return new RateLimitInspector(
        rateLimiter,
        new TermsOfServiceRegistry(tos == null ? Map.of() : Map.of(FANGRAPHS, tos)),
        monitor);
  }

  private static TermsOfService tosAllowing(int maxRequests, Duration period) {
    return new TermsOfService(FANGRAPHS, "2024.1", true, maxRequests, period, List.of());
  }

  @Nested
  @DisplayName("densestWindow")
  class DensestWindow {

    @Test
    @DisplayName("간격을 지킨 호출은 한 구간에 하나씩만 들어간다")
    void spacedCalls() {
      List<Instant> calls = List.of(T0, T0.plusSeconds(1), T0.plusSeconds(2), T0.plusSeconds(3));

      assertThat(RateLimitInspector.densestWindow(calls, Duration.ofSeconds(1))).isEqualTo(1);
    }

    @Test
    @DisplayName("period 안에 몰린 호출 수를 센다")
    void burst() {
      List<Instant> calls =
          List.of(T0, T0.plusMillis(200), T0.plusMillis(400), T0.plusSeconds(5));

      assertThat(RateLimitInspector.densestWindow(calls, Duration.ofSeconds(1))).isEqualTo(3);
    }

    @Test
    @DisplayName("측정 오차 이내로 당겨진 호출은 같은 구간으로 보지 않는다")
    void tolerance() {
      List<Instant> calls = List.of(T0, T0.plusMillis(997));

      assertThat(RateLimitInspector.densestWindow(calls, Duration.ofSeconds(1))).isEqualTo(1);
    }

    @Test
    @DisplayName("호출이 없으면 0")
    void empty() {
      assertThat(RateLimitInspector.densestWindow(List.of(), Duration.ofSeconds(1))).isZero();
    }
  }

  @Test
  @DisplayName("설정 한도가 약관보다 느슨하면 보고한다")
  void looserThanTerms() {
    given(rateLimiter.spec(FANGRAPHS)).willReturn(RateLimitSpec.perSecond(2));

    assertThat(inspector(tosAllowing(1, Duration.ofSeconds(1))).issuesFor(FANGRAPHS))
        .containsExactly(
            "Configured rate limit for fangraphs (2/PT1S) is looser than ToS limit (1/PT1S)");
  }

  @Test
  @DisplayName("호출 이력에 한도 초과 구간이 있으면 보고한다")
  void observedBurst() {
    given(rateLimiter.spec(FANGRAPHS)).willReturn(RateLimitSpec.perSecond(1));
    given(rateLimiter.recentDispatches(FANGRAPHS))
        .willReturn(List.of(T0, T0.plusMillis(500)));

    assertThat(inspector(tosAllowing(1, Duration.ofSeconds(1))).issuesFor(FANGRAPHS))
        .containsExactly("Rate limit exceeded for fangraphs: 2 calls within PT1S (limit 1)");
  }

  @Test
  @DisplayName("제공자 429 응답 이력이 있으면 보고한다")
  void providerRateLimited() {
    given(rateLimiter.spec(FANGRAPHS)).willReturn(RateLimitSpec.perSecond(1));
    given(monitor.rateLimitHits(FANGRAPHS)).willReturn(2);

    assertThat(inspector(null).issuesFor(FANGRAPHS))
        .containsExactly("Provider returned RATE_LIMITED 2 times recently for fangraphs");
  }

  @Test
  @DisplayName("약관 한도와 같거나 더 엄격하면 문제 없음")
  void compliant() {
    given(rateLimiter.spec(FANGRAPHS)).willReturn(RateLimitSpec.of(1, Duration.ofSeconds(2)));
    given(rateLimiter.recentDispatches(FANGRAPHS))
        .willReturn(List.of(T0, T0.plusSeconds(2), T0.plusSeconds(4)));

    assertThat(inspector(tosAllowing(1, Duration.ofSeconds(1))).issuesFor(FANGRAPHS)).isEmpty();
  }
}
