package finewine.acquisition.infrastructure.executor;

import finewine.acquisition.infrastructure.executor.function.ThrowingRunnable;
import finewine.acquisition.infrastructure.executor.function.ThrowingSupplier;
import finewine.acquisition.infrastructure.executor.strategy.ExceptionTranslator;
import java.util.function.Function;

/**
 * try/catch 를 대신하는 실행 템플릿.
 *
 * <h3>규약</h3>
 *
 * <ul>
 *   <li>{@link Error} 는 번역 없이 즉시 전파
 *   <li>{@link InterruptedException} 은 인터럽트 플래그를 복구한 뒤 번역/복구
 *   <li>실패는 {@link TaskContext#toTaskName()} 과 함께 한 번만 로그에 남김
 * </ul>
 */
public interface LogicExecutor {

  /** 실패 시 기본 번역기로 unchecked 예외로 바꿔 던집니다. */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  /** 실패 시 기본값을 반환합니다. 예외는 WARN 으로만 남습니다. */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /** 실패 시 번역된 예외를 recovery 에 넘깁니다. */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  /** 실패 시 원본(비동기 래퍼만 벗긴) 예외를 fallback 에 넘깁니다. 로그는 fallback 책임입니다. */
  <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context);

  /** 호출 측이 지정한 번역기로 예외를 바꿔 던집니다. */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
