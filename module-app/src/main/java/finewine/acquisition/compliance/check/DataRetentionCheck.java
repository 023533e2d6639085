package finewine.acquisition.compliance.check;

import finewine.acquisition.compliance.CheckReport;
import finewine.acquisition.compliance.ComplianceCheck;
import finewine.acquisition.compliance.policy.RetentionPolicy;
import finewine.acquisition.compliance.policy.RetentionPolicyRegistry;
import finewine.acquisition.core.port.out.RetentionCleaner;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.compliance.CheckId;
import finewine.acquisition.infrastructure.executor.LogicExecutor;
import finewine.acquisition.infrastructure.executor.TaskContext;
import finewine.acquisition.infrastructure.util.ExceptionUtils;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 보존 기간이 정해진 모든 분류에 대해 {@link RetentionCleaner} 를 실행합니다.
 *
 * <p>분류 하나가 실패해도 나머지는 계속 정리하고, 실패가 있으면 ERROR 로 보고합니다. 삭제된 레코드가 있으면 INFO 알림을 보냅니다.
 */
@Slf4j
@RequiredArgsConstructor
public class DataRetentionCheck implements ComplianceCheck {

  private final RetentionPolicyRegistry policies;
  private final RetentionCleaner cleaner;
  private final LogicExecutor executor;
  private final Clock clock;

  @Override
  public CheckId id() {
    return CheckId.DATA_RETENTION;
  }

  @Override
  public Duration defaultInterval() {
    return Duration.ofMinutes(1440);
  }

  @Override
  public CheckReport run() {
    Instant now = clock.instant();
    long totalCleaned = 0;
    List<String> failures = new ArrayList<>();
    for (RetentionPolicy policy : policies.finite()) {
      Instant cutoff = now.minus(Duration.ofDays(policy.retentionDays()));
      Long removed =
          executor.executeWithFallback(
              () -> cleaner.purgeOlderThan(policy.dataType(), policy.category(), cutoff),
              e -> {
                log.warn("[DataRetention] Cleanup failed for {}: {}", policy.key(), e.toString());
                failures.add(policy.key() + ": " + ExceptionUtils.describe(e));
                return null;
              },
              TaskContext.of("DataRetention", "Purge", policy.key()));
      if (removed != null) {
        totalCleaned += removed;
      }
    }
    log.info("[DataRetention] Cleanup completed: {} records cleaned", totalCleaned);

    if (!failures.isEmpty()) {
      return CheckReport.withIssues(
          id(), AlertSeverity.ERROR, "Data retention compliance check failed", failures);
    }
    if (totalCleaned > 0) {
      return CheckReport.info(
          id(), "Data retention cleanup completed: " + totalCleaned + " records cleaned");
    }
    return CheckReport.passed(id(), "Data retention compliance check completed");
  }
}
