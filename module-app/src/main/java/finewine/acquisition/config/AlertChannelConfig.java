package finewine.acquisition.config;

import finewine.acquisition.core.port.out.AlertPublisher;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.infrastructure.alert.ChannelAlertPublisher;
import finewine.acquisition.infrastructure.alert.channel.AlertChannel;
import finewine.acquisition.infrastructure.alert.channel.InMemoryAlertBuffer;
import finewine.acquisition.infrastructure.alert.channel.LocalFileAlertChannel;
import finewine.acquisition.infrastructure.alert.channel.WebhookAlertChannel;
import finewine.acquisition.infrastructure.alert.strategy.AlertChannelStrategy;
import finewine.acquisition.infrastructure.alert.strategy.SeverityAlertChannelStrategy;
import finewine.acquisition.infrastructure.executor.LogicExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * 알림 채널 라우팅.
 *
 * <pre>
 * CRITICAL, ERROR → webhook (URL 설정 시) → local file
 * WARNING, INFO   → in-memory buffer
 * </pre>
 *
 * <p>다른 {@link AlertPublisher} 빈이 있으면 기본 publisher 는 등록되지 않습니다.
 */
@Slf4j
@Configuration
public class AlertChannelConfig {

  @Bean
  public InMemoryAlertBuffer inMemoryAlertBuffer(AlertProperties properties) {
    return new InMemoryAlertBuffer(properties.bufferCapacity());
  }

  @Bean
  public LocalFileAlertChannel localFileAlertChannel(
      AlertProperties properties, LogicExecutor executor) {
    return new LocalFileAlertChannel(Path.of(properties.filePath()), executor);
  }

  @Bean
  public AlertChannelStrategy alertChannelStrategy(
      AlertProperties properties,
      InMemoryAlertBuffer buffer,
      LocalFileAlertChannel fileChannel,
      ObjectProvider<WebClient.Builder> webClientBuilder,
      LogicExecutor executor) {
    List<AlertChannel> urgent = new ArrayList<>();
    if (properties.webhookEnabled()) {
      WebClient webClient = webClientBuilder.getIfAvailable(WebClient::builder).build();
      urgent.add(
          new WebhookAlertChannel(
              webClient, properties.webhookUrl(), properties.webhookTimeout(), executor));
    }
    urgent.add(fileChannel);

    Map<AlertSeverity, List<AlertChannel>> routes = new EnumMap<>(AlertSeverity.class);
    routes.put(AlertSeverity.CRITICAL, urgent);
    routes.put(AlertSeverity.ERROR, urgent);
    routes.put(AlertSeverity.WARNING, List.of(buffer));
    routes.put(AlertSeverity.INFO, List.of(buffer));
    log.info(
        "[AlertChannel] Routing configured: webhook={}, file={}",
        properties.webhookEnabled(),
        properties.filePath());
    return new SeverityAlertChannelStrategy(routes);
  }

  @Bean
  @ConditionalOnMissingBean(AlertPublisher.class)
  public AlertPublisher alertPublisher(AlertChannelStrategy strategy, MeterRegistry meterRegistry) {
    return new ChannelAlertPublisher(strategy, meterRegistry);
  }
}
