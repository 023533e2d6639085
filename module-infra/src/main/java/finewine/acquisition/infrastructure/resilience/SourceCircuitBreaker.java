package finewine.acquisition.infrastructure.resilience;

import finewine.acquisition.domain.exception.CircuitOpenException;
import finewine.acquisition.domain.exception.UnknownSourceException;
import finewine.acquisition.domain.model.circuit.CircuitBreakerSnapshot;
import finewine.acquisition.domain.model.circuit.CircuitState;
import finewine.acquisition.domain.model.circuit.StateTransition;
import finewine.acquisition.domain.model.fetch.CallResult;
import finewine.acquisition.domain.model.source.CircuitBreakerSpec;
import finewine.acquisition.domain.model.source.SourceId;
import finewine.acquisition.infrastructure.executor.function.CheckedSupplier;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * 소스별 서킷 브레이커.
 *
 * <h3>상태 기계</h3>
 *
 * <pre>
 * CLOSED    --(연속 실패 failureThreshold회)--> OPEN
 * OPEN      --(recoveryTimeout 경과 후 첫 호출)--> HALF_OPEN (그 호출이 프로브)
 * HALF_OPEN --(연속 성공 successThreshold회)--> CLOSED
 * HALF_OPEN --(실패 1회)--> OPEN (openedAt 갱신)
 * </pre>
 *
 * <p>HALF_OPEN 에서는 한 번에 하나의 프로브만 허용합니다. 프로브가 진행 중이면 다른 호출은 차단됩니다.
 *
 * <h3>API</h3>
 *
 * <ul>
 *   <li>{@link #call}: 태그드 결과 반환 (차단 시 연산을 호출하지 않음)
 *   <li>{@link #execute}: 값 반환, 차단 시 {@link CircuitOpenException}
 *   <li>{@link #tryAcquirePermission} / {@link #onSuccess} / {@link #onFailure} / {@link
 *       #releasePermission}: 타임아웃/취소를 직접 다루는 오케스트레이터용 저수준 API
 * </ul>
 *
 * <p>잠금은 소스 단위이며, 전이 리스너는 락을 놓은 뒤 호출됩니다.
 */
@Slf4j
public class SourceCircuitBreaker {

  static final int MAX_HISTORY = 100;
  static final int SNAPSHOT_HISTORY = 10;

  private final Map<SourceId, BreakerState> states = new ConcurrentHashMap<>();
  private final Clock clock;
  private final CircuitStateListener listener;

  public SourceCircuitBreaker(Clock clock) {
    this(clock, CircuitStateListener.NOOP);
  }

  public SourceCircuitBreaker(Clock clock, CircuitStateListener listener) {
    this.clock = clock;
    this.listener = listener;
  }

  public void register(SourceId source, CircuitBreakerSpec spec) {
    register(source, spec, new DefaultFailureClassifier());
  }

  public void register(SourceId source, CircuitBreakerSpec spec, FailureClassifier classifier) {
    states.putIfAbsent(source, new BreakerState(source, spec, classifier, clock.instant()));
  }

  public boolean isRegistered(SourceId source) {
    return states.containsKey(source);
  }

  /**
   * 보호된 연산을 실행하고 태그드 결과를 반환합니다.
   *
   * <p>차단되면 연산을 호출하지 않고 {@code CIRCUIT_OPEN}. 연산 예외는 분류 결과와 함께 {@link CallResult#error()} 로 보존.
   * 인터럽트는 상태를 바꾸지 않고 {@code CANCELLED}.
   */
  public <T> CallResult<T> call(SourceId source, CheckedSupplier<T> operation) {
    Optional<Permit> permit = tryAcquirePermission(source);
    if (permit.isEmpty()) {
      return CallResult.rejected();
    }
    T value;
    try {
      value = operation.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      releasePermission(permit.get());
      return CallResult.cancelled(e);
    } catch (Exception e) {
      Classification classification = onFailure(permit.get(), e);
      return CallResult.failure(classification.kind(), e, classification.httpStatus());
    } catch (Error e) {
      releasePermission(permit.get());
      throw e;
    }
    onSuccess(permit.get());
    return CallResult.success(value);
  }

  /**
   * 보호된 연산의 값을 반환합니다.
   *
   * @throws CircuitOpenException 차단된 경우
   * @throws Exception 연산이 던진 원래 예외 (분류 후 그대로 전파)
   */
  public <T> T execute(SourceId source, CheckedSupplier<T> operation) throws Exception {
    CallResult<T> result = call(source, operation);
    if (result.isSuccess()) {
      return result.value();
    }
    if (result.isRejected()) {
      throw new CircuitOpenException(source);
    }
    if (result.error() instanceof Exception e) {
      throw e;
    }
    throw new IllegalStateException("call failed without cause: " + result.kind());
  }

  /** 지금 호출하면 차단되는지 여부. 상태를 바꾸지 않습니다. */
  public boolean isOpen(SourceId source) {
    BreakerState state = require(source);
    state.lock.lock();
    try {
      return switch (state.state) {
        case CLOSED -> false;
        case OPEN -> !state.recoveryElapsed(clock.instant());
        case HALF_OPEN -> state.probeInFlight;
      };
    } finally {
      state.lock.unlock();
    }
  }

  public CircuitState getState(SourceId source) {
    BreakerState state = require(source);
    state.lock.lock();
    try {
      return state.state;
    } finally {
      state.lock.unlock();
    }
  }

  /** 호출 허가를 요청합니다. 비어 있으면 차단된 것입니다. */
  public Optional<Permit> tryAcquirePermission(SourceId source) {
    BreakerState state = require(source);
    List<StateTransition> transitions = new ArrayList<>(1);
    Optional<Permit> permit;
    CircuitBreakerSnapshot snapshot = null;
    state.lock.lock();
    try {
      Instant now = clock.instant();
      state.totalRequests++;
      permit =
          switch (state.state) {
            case CLOSED -> Optional.of(state.permit(false));
            case OPEN -> {
              if (!state.recoveryElapsed(now)) {
                yield state.reject();
              }
              transitions.add(state.transition(CircuitState.HALF_OPEN, now, "recovery timeout elapsed"));
              state.successCount = 0;
              state.probeInFlight = true;
              yield Optional.of(state.permit(true));
            }
            case HALF_OPEN -> {
              if (state.probeInFlight) {
                yield state.reject();
              }
              state.probeInFlight = true;
              yield Optional.of(state.permit(true));
            }
          };
      if (!transitions.isEmpty()) {
        snapshot = state.snapshot();
      }
    } finally {
      state.lock.unlock();
    }
    if (permit.isEmpty() && log.isDebugEnabled()) {
      log.debug("[CircuitBreaker:{}] 호출 차단", source);
    }
    notifyListener(source, transitions, snapshot);
    return permit;
  }

  public void onSuccess(Permit permit) {
    BreakerState state = require(permit.source());
    List<StateTransition> transitions = new ArrayList<>(1);
    CircuitBreakerSnapshot snapshot = null;
    state.lock.lock();
    try {
      if (state.isStale(permit)) {
        return;
      }
      if (state.state == CircuitState.CLOSED) {
        state.failureCount = 0;
      } else if (state.state == CircuitState.HALF_OPEN) {
        state.probeInFlight = false;
        state.successCount++;
        if (state.successCount >= state.spec.successThreshold()) {
          transitions.add(state.transition(CircuitState.CLOSED, clock.instant(), "probe succeeded"));
          state.failureCount = 0;
          state.successCount = 0;
          state.openedAt = null;
        }
      }
      if (!transitions.isEmpty()) {
        snapshot = state.snapshot();
      }
    } finally {
      state.lock.unlock();
    }
    notifyListener(permit.source(), transitions, snapshot);
  }

  /**
   * 실패를 분류해 반영합니다. 실패로 세지 않는 결과(예: 404)는 상태를 바꾸지 않고 프로브 자리만 반납합니다.
   *
   * @return 분류 결과 (오케스트레이터가 OutcomeKind 로 사용)
   */
  public Classification onFailure(Permit permit, Throwable error) {
    BreakerState state = require(permit.source());
    Classification classification = state.classifier.classify(error);
    List<StateTransition> transitions = new ArrayList<>(1);
    CircuitBreakerSnapshot snapshot = null;
    state.lock.lock();
    try {
      if (!classification.countsAsFailure()) {
        state.releaseProbe(permit);
        return classification;
      }
      Instant now = clock.instant();
      state.totalFailures++;
      state.lastFailureAt = now;
      if (state.isStale(permit)) {
        return classification;
      }
      if (state.state == CircuitState.CLOSED) {
        state.failureCount++;
        if (state.failureCount >= state.spec.failureThreshold()) {
          transitions.add(state.transition(CircuitState.OPEN, now, classification.detail()));
          state.openedAt = now;
        }
      } else if (state.state == CircuitState.HALF_OPEN) {
        state.failureCount++;
        transitions.add(state.transition(CircuitState.OPEN, now, classification.detail()));
        state.openedAt = now;
        state.successCount = 0;
        state.probeInFlight = false;
      }
      if (!transitions.isEmpty()) {
        snapshot = state.snapshot();
      }
    } finally {
      state.lock.unlock();
    }
    notifyListener(permit.source(), transitions, snapshot);
    return classification;
  }

  /** 취소된 시도의 허가를 기록 없이 반납합니다. */
  public void releasePermission(Permit permit) {
    BreakerState state = require(permit.source());
    state.lock.lock();
    try {
      state.releaseProbe(permit);
    } finally {
      state.lock.unlock();
    }
  }

  /** 강제로 CLOSED 로 되돌리고 카운터를 초기화합니다. 여러 번 호출해도 결과는 같습니다. */
  public CircuitBreakerSnapshot reset(SourceId source) {
    BreakerState state = require(source);
    List<StateTransition> transitions = new ArrayList<>(1);
    CircuitBreakerSnapshot snapshot;
    state.lock.lock();
    try {
      if (state.state != CircuitState.CLOSED) {
        transitions.add(state.transition(CircuitState.CLOSED, clock.instant(), "manual reset"));
      } else {
        // 초기화 이전에 허가된 호출의 결과가 새 카운터에 섞이지 않도록 세대를 넘김
        state.generation++;
      }
      state.failureCount = 0;
      state.successCount = 0;
      state.probeInFlight = false;
      state.openedAt = null;
      snapshot = state.snapshot();
    } finally {
      state.lock.unlock();
    }
    log.info("[CircuitBreaker:{}] 수동 초기화 완료", source);
    notifyListener(source, transitions, snapshot);
    return snapshot;
  }

  public CircuitBreakerSnapshot getMetrics(SourceId source) {
    BreakerState state = require(source);
    state.lock.lock();
    try {
      return state.snapshot();
    } finally {
      state.lock.unlock();
    }
  }

  /** 전체 전이 이력 (최대 {@value #MAX_HISTORY}건, 오래된 순) */
  public List<StateTransition> getStateHistory(SourceId source) {
    BreakerState state = require(source);
    state.lock.lock();
    try {
      return List.copyOf(state.history);
    } finally {
      state.lock.unlock();
    }
  }

  private void notifyListener(
      SourceId source, List<StateTransition> transitions, CircuitBreakerSnapshot snapshot) {
    for (StateTransition transition : transitions) {
      listener.onStateTransition(source, transition, snapshot);
    }
  }

  private BreakerState require(SourceId source) {
    BreakerState state = states.get(source);
    if (state == null) {
      throw new UnknownSourceException(source);
    }
    return state;
  }

  private static final class BreakerState {
    private final ReentrantLock lock = new ReentrantLock();
    private final SourceId source;
    private final CircuitBreakerSpec spec;
    private final FailureClassifier classifier;
    private final Deque<StateTransition> history = new ArrayDeque<>();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private boolean probeInFlight;
    private long generation;
    private Instant lastFailureAt;
    private Instant openedAt;
    private Instant lastStateChange;
    private long totalRequests;
    private long totalFailures;
    private long totalRejections;

    private BreakerState(
        SourceId source, CircuitBreakerSpec spec, FailureClassifier classifier, Instant createdAt) {
      this.source = source;
      this.spec = spec;
      this.classifier = classifier;
      this.lastStateChange = createdAt;
    }

    private boolean recoveryElapsed(Instant now) {
      return openedAt == null || !now.isBefore(openedAt.plus(spec.recoveryTimeout()));
    }

    private Permit permit(boolean probe) {
      return new Permit(source, generation, probe);
    }

    private Optional<Permit> reject() {
      totalRejections++;
      return Optional.empty();
    }

    private boolean isStale(Permit permit) {
      return permit.generation() != generation;
    }

    private void releaseProbe(Permit permit) {
      if (!isStale(permit) && permit.probe() && state == CircuitState.HALF_OPEN) {
        probeInFlight = false;
      }
    }

    private StateTransition transition(CircuitState to, Instant now, String reason) {
      StateTransition transition = new StateTransition(state, to, now, failureCount, reason);
      state = to;
      generation++;
      lastStateChange = now;
      if (history.size() == MAX_HISTORY) {
        history.removeFirst();
      }
      history.addLast(transition);
      return transition;
    }

    private CircuitBreakerSnapshot snapshot() {
      double failureRate = totalRequests == 0 ? 0.0 : (double) totalFailures / totalRequests;
      List<StateTransition> recent = new ArrayList<>(history);
      if (recent.size() > SNAPSHOT_HISTORY) {
        recent = recent.subList(recent.size() - SNAPSHOT_HISTORY, recent.size());
      }
      return new CircuitBreakerSnapshot(
          source,
          state,
          failureCount,
          successCount,
          lastFailureAt,
          openedAt,
          lastStateChange,
          totalRequests,
          totalFailures,
          totalRejections,
          failureRate,
          recent,
          spec);
    }
  }
}
