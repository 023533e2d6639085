package finewine.acquisition.infrastructure.alert.strategy;

import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.infrastructure.alert.channel.AlertChannel;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 심각도 → 채널 체인 고정 매핑.
 *
 * <ul>
 *   <li>CRITICAL, ERROR: 즉시 전달 채널(webhook) → 로컬 파일
 *   <li>WARNING, INFO: 메모리 버퍼
 * </ul>
 *
 * <p>매핑되지 않은 심각도는 빈 체인을 반환합니다.
 */
public class SeverityAlertChannelStrategy implements AlertChannelStrategy {

  private final Map<AlertSeverity, List<AlertChannel>> routes;

  public SeverityAlertChannelStrategy(Map<AlertSeverity, List<AlertChannel>> routes) {
    this.routes = new EnumMap<>(AlertSeverity.class);
    routes.forEach((severity, chain) -> this.routes.put(severity, List.copyOf(chain)));
  }

  @Override
  public List<AlertChannel> getChannels(AlertSeverity severity) {
    return routes.getOrDefault(severity, List.of());
  }
}
