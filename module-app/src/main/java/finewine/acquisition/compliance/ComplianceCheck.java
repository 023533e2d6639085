package finewine.acquisition.compliance;

import finewine.acquisition.domain.model.compliance.CheckId;
import java.time.Duration;

/**
 * 주기적으로 실행되는 컴플라이언스 점검.
 *
 * <p>구현체는 발견 사항을 {@link CheckReport} 로 돌려주기만 하고, 알림 발송은 {@link ComplianceScheduler} 가 담당합니다.
 * 예외를 던지면 스케줄러가 ERROR 알림으로 처리합니다.
 */
public interface ComplianceCheck {

  CheckId id();

  Duration defaultInterval();

  CheckReport run() throws Exception;
}
