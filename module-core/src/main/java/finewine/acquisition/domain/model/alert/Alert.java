package finewine.acquisition.domain.model.alert;

import finewine.acquisition.domain.model.source.SourceId;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 운영자에게 전달되는 알림 (불변).
 *
 * @param component 알림을 만든 컴포넌트 (예: {@code PipelineMonitor}, {@code compliance:tos_compliance})
 * @param source 관련 소스, 없으면 null
 */
public record Alert(
    AlertSeverity severity, String message, Instant timestamp, String component, SourceId source) {

  public Alert {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(component, "component");
  }

  public static Alert of(
      AlertSeverity severity, String message, String component, Instant timestamp) {
    return new Alert(severity, message, timestamp, component, null);
  }

  public Optional<SourceId> sourceId() {
    return Optional.ofNullable(source);
  }

  public boolean isAtLeast(AlertSeverity threshold) {
    return severity.isAtLeast(threshold);
  }
}
