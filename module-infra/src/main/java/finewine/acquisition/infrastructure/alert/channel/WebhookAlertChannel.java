package finewine.acquisition.infrastructure.alert.channel;

import finewine.acquisition.domain.model.alert.Alert;
import finewine.acquisition.infrastructure.alert.message.AlertMessageFormatter;
import finewine.acquisition.infrastructure.executor.LogicExecutor;
import finewine.acquisition.infrastructure.executor.TaskContext;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

/** Discord 호환 webhook 으로 알림을 POST 합니다. */
@Slf4j
public class WebhookAlertChannel implements AlertChannel {

  private final WebClient webClient;
  private final String webhookUrl;
  private final Duration timeout;
  private final LogicExecutor executor;

  public WebhookAlertChannel(
      WebClient webClient, String webhookUrl, Duration timeout, LogicExecutor executor) {
    this.webClient = webClient;
    this.webhookUrl = webhookUrl;
    this.timeout = timeout;
    this.executor = executor;
  }

  @Override
  public boolean send(Alert alert) {
    return executor.executeWithFallback(
        () -> post(alert),
        e -> handleFailure(alert, e),
        TaskContext.of("AlertChannel", "Webhook", alert.severity().name()));
  }

  private boolean post(Alert alert) {
    ResponseEntity<Void> response =
        webClient
            .post()
            .uri(webhookUrl)
            .bodyValue(AlertMessageFormatter.toWebhookPayload(alert))
            .retrieve()
            .toBodilessEntity()
            .block(timeout);

    boolean success = response != null && response.getStatusCode().is2xxSuccessful();
    if (!success && log.isWarnEnabled()) {
      log.warn(
          "[WebhookAlertChannel] Alert rejected with status {}",
          response == null ? "none" : response.getStatusCode());
    }
    return success;
  }

  private boolean handleFailure(Alert alert, Throwable e) {
    if (e instanceof WebClientRequestException) {
      log.warn("[WebhookAlertChannel] Webhook request failed: {}", e.getMessage());
    } else {
      log.error(
          "[WebhookAlertChannel] Unexpected error sending {} alert: {}",
          alert.severity(),
          e.getMessage(),
          e);
    }
    return false;
  }

  @Override
  public String getChannelName() {
    return "webhook";
  }
}
