package finewine.acquisition.core.port.out;

import java.time.Instant;

/** 보존 기간이 지난 레코드를 삭제하는 저장소 측 포트. */
public interface RetentionCleaner {

  /**
   * @param dataType 정책 그룹 (예: prospect_data)
   * @param category 세부 분류 (예: raw_stats)
   * @param cutoff 이 시각 이전 레코드 삭제
   * @return 삭제된 레코드 수
   */
  long purgeOlderThan(String dataType, String category, Instant cutoff) throws Exception;
}
