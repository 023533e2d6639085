package finewine.acquisition.status;

import finewine.acquisition.domain.model.circuit.CircuitState;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Actuator {@code dataSources} 헬스 항목.
 *
 * <ul>
 *   <li>UP: 활성 소스 중 하나 이상의 서킷이 CLOSED
 *   <li>DOWN: 활성 소스가 없거나 모든 활성 소스의 서킷이 열림
 * </ul>
 *
 * <p>{@code serviceLevel} 상세 항목에 현재 degradation 수준을 함께 노출합니다.
 */
@RequiredArgsConstructor
public class DataSourcesHealthIndicator implements HealthIndicator {

  private final AcquisitionStatusService statusService;

  @Override
  public Health health() {
    List<SourceHealth> sources = statusService.getAllServiceHealth();
    Map<String, Object> details = new LinkedHashMap<>();
    boolean anyAvailable = false;
    for (SourceHealth source : sources) {
      Map<String, Object> detail = new LinkedHashMap<>();
      detail.put("circuitState", source.circuitState().name());
      detail.put("active", source.sourceActive());
      detail.put("failureStreak", source.failureStreak());
      if (source.lastSuccess() != null) {
        detail.put("lastSuccess", source.lastSuccess().toString());
      }
      details.put(source.source().value(), detail);
      if (source.sourceActive() && source.circuitState() == CircuitState.CLOSED) {
        anyAvailable = true;
      }
    }
    details.put("serviceLevel", statusService.getDegradationStatus().level().name());
    Health.Builder builder = anyAvailable ? Health.up() : Health.down();
    return builder.withDetails(details).build();
  }
}
