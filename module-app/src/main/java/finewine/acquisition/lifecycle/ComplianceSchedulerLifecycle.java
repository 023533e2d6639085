package finewine.acquisition.lifecycle;

import finewine.acquisition.compliance.ComplianceScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * 애플리케이션 기동/종료에 맞춰 컴플라이언스 스케줄러를 시작/정지합니다.
 *
 * <p>{@code acquisition.compliance.enabled=false} 이면 빈이 등록되지 않아 스케줄러는 수동 실행만 가능합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class ComplianceSchedulerLifecycle implements SmartLifecycle {

  private final ComplianceScheduler scheduler;

  @Override
  public void start() {
    scheduler.start();
  }

  @Override
  public void stop() {
    if (scheduler.isRunning()) {
      scheduler.stop();
    }
    log.debug("[ComplianceSchedulerLifecycle] Stopped");
  }

  @Override
  public boolean isRunning() {
    return scheduler.isRunning();
  }
}
