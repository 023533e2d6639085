package finewine.acquisition.monitor;

import finewine.acquisition.config.MonitorProperties;
import finewine.acquisition.core.port.out.AlertPublisher;
import finewine.acquisition.core.port.out.FetchOutcomeListener;
import finewine.acquisition.domain.model.alert.Alert;
import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.fetch.FetchOutcome;
import finewine.acquisition.domain.model.fetch.OutcomeKind;
import finewine.acquisition.domain.model.monitor.FreshnessRecord;
import finewine.acquisition.domain.model.monitor.FreshnessReport;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.infrastructure.executor.LogicExecutor;
import finewine.acquisition.infrastructure.executor.TaskContext;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * 수집 파이프라인 모니터.
 *
 * <h3>책임</h3>
 *
 * <ul>
 *   <li>모든 fetch 결과를 소스별 {@link FreshnessRecord} 에 반영
 *   <li>연속 실패 임계값 도달 시 ERROR, 시간 창 내 429 누적 시 WARNING 알림
 *   <li>알림 이력 보관 후 {@link AlertPublisher} 로 전달 (전달 실패는 로그만 남기고 삼킴)
 * </ul>
 *
 * <p>연속 실패 알림은 임계값에 도달했을 때와 그 배수마다 한 번씩 발생합니다.
 */
@Slf4j
public class PipelineMonitor {

  static final String COMPONENT = "PipelineMonitor";

  private final Map<SourceId, FreshnessRecord> freshness = new ConcurrentHashMap<>();
  private final Map<SourceId, Deque<Instant>> rateLimitHits = new ConcurrentHashMap<>();
  private final Deque<Alert> alertHistory = new ArrayDeque<>();

  private final Clock clock;
  private final MonitorProperties properties;
  private final AlertPublisher alertPublisher;
  private final MeterRegistry meterRegistry;
  private final LogicExecutor executor;
  private final List<FetchOutcomeListener> listeners;

  public PipelineMonitor(
      Clock clock,
      MonitorProperties properties,
      AlertPublisher alertPublisher,
      MeterRegistry meterRegistry,
      LogicExecutor executor,
      List<FetchOutcomeListener> listeners) {
    this.clock = clock;
    this.properties = properties;
    this.alertPublisher = alertPublisher;
    this.meterRegistry = meterRegistry;
    this.executor = executor;
    this.listeners = List.copyOf(listeners);
  }

  public void recordOutcome(FetchOutcome outcome) {
    SourceId source = outcome.source();
    FreshnessRecord updated =
        freshness.compute(
            source,
            (id, previous) -> (previous == null ? FreshnessRecord.empty(id) : previous).apply(outcome));

    Counter.builder("acquisition.fetch.outcomes")
        .tag("source", source.value())
        .tag("kind", outcome.kind().name())
        .register(meterRegistry)
        .increment();

    if (outcome.kind() == OutcomeKind.RATE_LIMITED) {
      int hits = recordRateLimitHit(source, outcome.timestamp());
      if (hits == properties.rateLimitHitThreshold()) {
        sendAlert(
            AlertSeverity.WARNING,
            String.format(
                "Source %s rate limited %d times within %s", source, hits, properties.rateLimitWindow()),
            COMPONENT,
            source);
      }
    }

    int threshold = properties.consecutiveFailureThreshold();
    if (!outcome.isSuccess()
        && outcome.kind().reflectsProviderHealth()
        && updated.failureStreak() >= threshold
        && updated.failureStreak() % threshold == 0) {
      sendAlert(
          AlertSeverity.ERROR,
          String.format(
              "Source %s failed %d consecutive times (last: %s)",
              source, updated.failureStreak(), outcome.describe()),
          COMPONENT,
          source);
    }

    notifyListeners(outcome);
  }

  /** 성공 이력이 없으면 신선하지 않은 것으로 판정합니다. */
  public FreshnessReport checkFreshness(SourceId source, Duration maxAge) {
    FreshnessRecord record = freshness(source);
    if (!record.hasSucceeded()) {
      return new FreshnessReport(
          source, false, null, null, maxAge, "no successful fetch recorded");
    }
    Duration age = Duration.between(record.lastSuccess(), clock.instant());
    boolean fresh = age.compareTo(maxAge) <= 0;
    String reason = fresh ? "fresh" : "last success " + age + " ago exceeds " + maxAge;
    return new FreshnessReport(source, fresh, record.lastSuccess(), age, maxAge, reason);
  }

  public FreshnessReport checkFreshness(SourceId source) {
    return checkFreshness(source, properties.defaultMaxAge());
  }

  public List<FreshnessReport> staleSources(Collection<SourceId> sources, Duration maxAge) {
    return sources.stream()
        .map(source -> checkFreshness(source, maxAge))
        .filter(report -> !report.fresh())
        .toList();
  }

  public FreshnessRecord freshness(SourceId source) {
    return freshness.getOrDefault(source, FreshnessRecord.empty(source));
  }

  public Optional<Instant> lastSuccess(SourceId source) {
    return Optional.ofNullable(freshness(source).lastSuccess());
  }

  /** 시간 창 안에 기록된 RATE_LIMITED 결과 수. */
  public int rateLimitHits(SourceId source) {
    Deque<Instant> hits = rateLimitHits.get(source);
    if (hits == null) {
      return 0;
    }
    synchronized (hits) {
      evictExpired(hits, clock.instant());
      return hits.size();
    }
  }

  public void sendAlert(AlertSeverity severity, String message, String component) {
    sendAlert(severity, message, component, null);
  }

  public void sendAlert(AlertSeverity severity, String message, String component, SourceId source) {
    Alert alert = new Alert(severity, message, clock.instant(), component, source);
    logAlert(alert);
    remember(alert);
    Counter.builder("acquisition.alerts")
        .tag("severity", severity.name())
        .register(meterRegistry)
        .increment();

    executor.executeOrCatch(
        () -> {
          alertPublisher.publish(alert);
          return null;
        },
        e -> {
          log.warn("[PipelineMonitor] Alert delivery failed: severity={}, cause={}", severity, e.toString());
          return null;
        },
        TaskContext.of("PipelineMonitor", "PublishAlert", severity.name()));
  }

  /** 최신 알림이 마지막에 오도록 최대 {@code limit} 건을 반환합니다. */
  public List<Alert> recentAlerts(int limit) {
    synchronized (alertHistory) {
      List<Alert> all = new ArrayList<>(alertHistory);
      return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }
  }

  private int recordRateLimitHit(SourceId source, Instant at) {
    Deque<Instant> hits = rateLimitHits.computeIfAbsent(source, id -> new ArrayDeque<>());
    synchronized (hits) {
      hits.addLast(at);
      evictExpired(hits, at);
      return hits.size();
    }
  }

  private void evictExpired(Deque<Instant> hits, Instant now) {
    Instant windowStart = now.minus(properties.rateLimitWindow());
    while (!hits.isEmpty() && hits.peekFirst().isBefore(windowStart)) {
      hits.pollFirst();
    }
  }

  private void remember(Alert alert) {
    synchronized (alertHistory) {
      alertHistory.addLast(alert);
      while (alertHistory.size() > properties.alertHistorySize()) {
        alertHistory.pollFirst();
      }
    }
  }

  private void notifyListeners(FetchOutcome outcome) {
    for (FetchOutcomeListener listener : listeners) {
      executor.executeOrDefault(
          () -> {
            listener.onOutcome(outcome);
            return null;
          },
          null,
          TaskContext.of("PipelineMonitor", "NotifyListener", listener.getClass().getSimpleName()));
    }
  }

  private static void logAlert(Alert alert) {
    String source = alert.sourceId().map(SourceId::value).orElse("-");
    switch (alert.severity()) {
      case CRITICAL, ERROR ->
          log.error(
              "[Alert:{}] {} (component={}, source={})",
              alert.severity(),
              alert.message(),
              alert.component(),
              source);
      case WARNING ->
          log.warn(
              "[Alert:{}] {} (component={}, source={})",
              alert.severity(),
              alert.message(),
              alert.component(),
              source);
      default ->
          log.info(
              "[Alert:{}] {} (component={}, source={})",
              alert.severity(),
              alert.message(),
              alert.component(),
              source);
    }
  }
}
