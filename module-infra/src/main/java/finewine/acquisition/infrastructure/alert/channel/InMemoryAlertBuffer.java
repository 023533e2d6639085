package finewine.acquisition.infrastructure.alert.channel;

import finewine.acquisition.domain.model.alert.Alert;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import lombok.extern.slf4j.Slf4j;

/**
 * 용량이 고정된 메모리 알림 버퍼.
 *
 * <p>가득 차면 가장 오래된 알림을 버리고 새 알림을 넣습니다. 운영자는 {@link #snapshot()} 으로 조회하거나 {@link
 * #drainTo(AlertChannel)} 로 다른 채널에 재전송합니다.
 */
@Slf4j
public class InMemoryAlertBuffer implements AlertChannel {

  private final BlockingQueue<Alert> buffer;

  public InMemoryAlertBuffer(int capacity) {
    this.buffer = new ArrayBlockingQueue<>(capacity);
  }

  @Override
  public synchronized boolean send(Alert alert) {
    while (!buffer.offer(alert)) {
      Alert dropped = buffer.poll();
      if (dropped != null && log.isWarnEnabled()) {
        log.warn("[InMemoryAlertBuffer] Buffer full, dropping oldest alert: {}", dropped.message());
      }
    }
    return true;
  }

  @Override
  public String getChannelName() {
    return "in-memory";
  }

  public int getBufferSize() {
    return buffer.size();
  }

  public List<Alert> snapshot() {
    return List.copyOf(buffer);
  }

  /** 버퍼를 비우며 대상 채널로 재전송합니다. 전송에 실패한 알림은 버려지고 로그로 남습니다. */
  public synchronized int drainTo(AlertChannel target) {
    List<Alert> pending = new ArrayList<>();
    buffer.drainTo(pending);
    int drained = 0;
    for (Alert alert : pending) {
      if (target.send(alert)) {
        drained++;
      } else if (log.isWarnEnabled()) {
        log.warn(
            "[InMemoryAlertBuffer] Failed to drain alert to {}: {}",
            target.getChannelName(),
            alert.message());
      }
    }
    return drained;
  }
}
