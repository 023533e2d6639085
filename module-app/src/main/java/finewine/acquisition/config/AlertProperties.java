package finewine.acquisition.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 알림 채널 설정. {@code webhook-url} 이 비어 있으면 webhook 채널을 만들지 않습니다.
 *
 * <pre>{@code
 * acquisition:
 *   alert:
 *     webhook-url: ${ALERT_WEBHOOK_URL:}
 *     file-path: logs/critical-alerts.log
 *     buffer-capacity: 1000
 * }</pre>
 */
@ConfigurationProperties(prefix = "acquisition.alert")
public record AlertProperties(
    @DefaultValue("") String webhookUrl,
    @DefaultValue("5s") Duration webhookTimeout,
    @DefaultValue("logs/critical-alerts.log") String filePath,
    @DefaultValue("1000") int bufferCapacity) {

  public AlertProperties {
    if (bufferCapacity <= 0) {
      throw new IllegalArgumentException(
          "acquisition.alert.buffer-capacity must be positive, got: " + bufferCapacity);
    }
  }

  public boolean webhookEnabled() {
    return webhookUrl != null && !webhookUrl.isBlank();
  }
}
