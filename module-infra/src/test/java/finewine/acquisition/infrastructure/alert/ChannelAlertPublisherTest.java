package finewine.acquisition.infrastructure.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import finewine.acquisition.domain.model.alert.Alert;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.infrastructure.alert.channel.AlertChannel;
import finewine.acquisition.infrastructure.alert.channel.InMemoryAlertBuffer;
import finewine.acquisition.infrastructure.alert.strategy.SeverityAlertChannelStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ChannelAlertPublisherTest {

  private AlertChannel webhook;
  private AlertChannel file;
  private InMemoryAlertBuffer buffer;
  private SimpleMeterRegistry meterRegistry;
  private ChannelAlertPublisher publisher;

  @BeforeEach
  void setUp() {
    webhook = mock(AlertChannel.class);
    file = mock(AlertChannel.class);
    given(webhook.getChannelName()).willReturn("webhook");
    given(file.getChannelName()).willReturn("local-file");
    buffer = new InMemoryAlertBuffer(10);
    meterRegistry = new SimpleMeterRegistry();
    publisher =
        new ChannelAlertPublisher(
            new SeverityAlertChannelStrategy(
                Map.of(
                    AlertSeverity.CRITICAL, List.of(webhook, file),
                    AlertSeverity.ERROR, List.of(webhook, file),
                    AlertSeverity.WARNING, List.of(buffer),
                    AlertSeverity.INFO, List.of(buffer))),
            meterRegistry);
  }

  @Test
  @DisplayName("첫 채널이 성공하면 다음 채널은 시도하지 않는다")
  void stopsAtFirstSuccess() {
    // given
    given(webhook.send(any())).willReturn(true);

    // when
    publisher.publish(alert(AlertSeverity.CRITICAL));

    // then
    verify(file, never()).send(any());
    assertThat(
            meterRegistry
                .get("acquisition.alerts.delivery")
                .tags("channel", "webhook", "result", "success")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("webhook 실패 시 로컬 파일로 넘어간다")
  void fallsBackToFile() {
    // given
    given(webhook.send(any())).willReturn(false);
    given(file.send(any())).willReturn(true);

    // when
    publisher.publish(alert(AlertSeverity.ERROR));

    // then
    verify(file).send(any());
  }

  @Test
  @DisplayName("모든 채널이 실패해도 예외를 던지지 않는다")
  void neverThrowsWhenAllFail() {
    given(webhook.send(any())).willReturn(false);
    given(file.send(any())).willReturn(false);

    assertThatCode(() -> publisher.publish(alert(AlertSeverity.CRITICAL)))
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("WARNING/INFO 는 메모리 버퍼로 간다")
  void lowSeverityGoesToBuffer() {
    publisher.publish(alert(AlertSeverity.WARNING));
    publisher.publish(alert(AlertSeverity.INFO));

    assertThat(buffer.snapshot())
        .extracting(Alert::severity)
        .containsExactly(AlertSeverity.WARNING, AlertSeverity.INFO);
    verify(webhook, never()).send(any());
  }

  private static Alert alert(AlertSeverity severity) {
    return Alert.of(severity, "test alert", "Test", Instant.parse("2026-04-01T00:00:00Z"));
  }
}
