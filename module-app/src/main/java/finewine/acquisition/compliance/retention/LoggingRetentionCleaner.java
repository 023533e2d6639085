package finewine.acquisition.compliance.retention;

import finewine.acquisition.core.port.out.RetentionCleaner;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

/**
 * 저장소가 연결되지 않았을 때의 기본 정리기. 삭제 대상만 로그로 남기고 0 을 반환합니다.
 *
 * <p>실제 저장소 구현이 {@link RetentionCleaner} 빈으로 등록되면 대체됩니다.
 */
@Slf4j
public class LoggingRetentionCleaner implements RetentionCleaner {

  @Override
  public long purgeOlderThan(String dataType, String category, Instant cutoff) {
    log.info("[Retention] Cleaning {}.{} older than {}", dataType, category, cutoff);
    return 0;
  }
}
