package finewine.acquisition.infrastructure.alert.message;

import finewine.acquisition.domain.model.alert.Alert;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/** 채널별 알림 포맷. */
public final class AlertMessageFormatter {

  private static final int WEBHOOK_CONTENT_LIMIT = 2000;

  /** 한 줄 텍스트: {@code 2026-04-01T00:00:00Z [ERROR] PipelineMonitor (fangraphs): message} */
  public static String toLine(Alert alert) {
    StringBuilder sb =
        new StringBuilder()
            .append(DateTimeFormatter.ISO_INSTANT.format(alert.timestamp()))
            .append(" [")
            .append(alert.severity())
            .append("] ")
            .append(alert.component());
    alert.sourceId().ifPresent(source -> sb.append(" (").append(source).append(')'));
    return sb.append(": ").append(alert.message()).toString();
  }

  /** Discord 호환 webhook 본문. content 는 제공자 한도에 맞게 자릅니다. */
  public static Map<String, Object> toWebhookPayload(Alert alert) {
    String content = "**[" + alert.severity() + "]** " + toLine(alert);
    if (content.length() > WEBHOOK_CONTENT_LIMIT) {
      content = content.substring(0, WEBHOOK_CONTENT_LIMIT - 3) + "...";
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("username", "acquisition-monitor");
    payload.put("content", content);
    return payload;
  }

  private AlertMessageFormatter() {}
}
