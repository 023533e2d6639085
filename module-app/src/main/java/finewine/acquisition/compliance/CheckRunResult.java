package finewine.acquisition.compliance;

import finewine.acquisition.domain.model.compliance.CheckId;
import java.time.Duration;
import java.time.Instant;

/**
 * 점검 실행 결과. 수동 실행({@link ComplianceScheduler#runManualCheck})의 반환값이기도 합니다.
 *
 * @param report 완료된 경우의 발견 사항, 실패/스킵이면 null
 * @param error 실패 사유, 없으면 null
 */
public record CheckRunResult(
    CheckId checkName,
    CheckRunStatus status,
    Instant startTime,
    Instant endTime,
    CheckReport report,
    String error) {

  public static CheckRunResult skipped(CheckId check, Instant at) {
    return new CheckRunResult(check, CheckRunStatus.SKIPPED, at, at, null, "check already running");
  }

  public double durationSeconds() {
    return Duration.between(startTime, endTime).toNanos() / 1_000_000_000.0;
  }

  public boolean isCompleted() {
    return status == CheckRunStatus.COMPLETED;
  }
}
