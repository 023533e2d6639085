package finewine.acquisition.compliance;

import finewine.acquisition.domain.model.alert.Alert;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 컴플라이언스 스케줄러 상태 조회 결과.
 *
 * @param lastRunTimes 점검 이름 → 마지막 정기 실행 시각 (한 번도 실행되지 않았으면 키 없음)
 * @param checkIntervals 점검 이름 → 주기(분)
 */
public record MonitoringStatus(
    boolean running,
    Map<String, Instant> lastRunTimes,
    Map<String, Long> checkIntervals,
    Map<String, String> lastStatuses,
    List<Alert> recentAlerts,
    int complianceHistoryCount,
    List<ComplianceHistory.Entry> recentHistory) {}
