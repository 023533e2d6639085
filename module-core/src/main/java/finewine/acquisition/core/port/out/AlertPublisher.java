package finewine.acquisition.core.port.out;

import finewine.acquisition.domain.model.alert.Alert;

/**
 * 알림 발송 포트.
 *
 * <h3>Role</h3>
 *
 * <p>모니터와 컴플라이언스 스케줄러는 이 추상화에만 의존합니다. 실제 채널(Webhook, 파일, 메모리 버퍼) 선택은 module-infra 구현체가
 * 담당합니다.
 *
 * <p>구현체는 전달 실패 시 예외를 던질 수 있으며, 호출 측({@code PipelineMonitor})이 로그로 흡수합니다.
 */
public interface AlertPublisher {

  void publish(Alert alert);
}
