package finewine.acquisition.infrastructure.alert;

import finewine.acquisition.core.port.out.AlertPublisher;
import finewine.acquisition.domain.model.alert.Alert;
import finewine.acquisition.infrastructure.alert.channel.AlertChannel;
import finewine.acquisition.infrastructure.alert.strategy.AlertChannelStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 채널 체인 기반 {@link AlertPublisher}.
 *
 * <p>심각도별 체인을 앞에서부터 시도해 처음 성공한 채널에서 멈춥니다. 모든 채널이 실패해도 예외를 던지지 않고 WARN 로그만 남깁니다.
 */
@Slf4j
@RequiredArgsConstructor
public class ChannelAlertPublisher implements AlertPublisher {

  private static final String DELIVERY_COUNTER = "acquisition.alerts.delivery";

  private final AlertChannelStrategy strategy;
  private final MeterRegistry meterRegistry;

  @Override
  public void publish(Alert alert) {
    List<AlertChannel> chain = strategy.getChannels(alert.severity());
    for (AlertChannel channel : chain) {
      if (channel.send(alert)) {
        deliveryCounter(channel.getChannelName(), "success").increment();
        return;
      }
      deliveryCounter(channel.getChannelName(), "failure").increment();
      log.debug("[AlertPublisher] {} 채널 전달 실패, 다음 채널 시도", channel.getChannelName());
    }
    if (!chain.isEmpty()) {
      log.warn(
          "[AlertPublisher] All channels failed for {} alert: {}",
          alert.severity(),
          alert.message());
    }
  }

  private Counter deliveryCounter(String channel, String result) {
    return Counter.builder(DELIVERY_COUNTER)
        .tag("channel", channel)
        .tag("result", result)
        .register(meterRegistry);
  }
}
