package finewine.acquisition.infrastructure.executor;

import finewine.acquisition.infrastructure.executor.function.ThrowingRunnable;
import finewine.acquisition.infrastructure.executor.function.ThrowingSupplier;
import finewine.acquisition.infrastructure.executor.strategy.ExceptionTranslator;
import finewine.acquisition.infrastructure.util.ExceptionUtils;
import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link LogicExecutor} 기본 구현.
 *
 * <ul>
 *   <li><b>Error 즉시 rethrow</b>: VirtualMachineError 등은 번역하지 않음
 *   <li><b>번역기 실패 격리</b>: 번역기가 던진 RuntimeException 은 그대로 primary 로 사용
 *   <li><b>인터럽트 보존</b>: InterruptedException 을 삼키지 않고 플래그 복구
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExceptionTranslator translator;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, translator, context);
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(
        task,
        e -> {
          log.warn("[Task:DEFAULT] {} → default value ({})", context.toTaskName(), e.toString());
          return defaultValue;
        },
        context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      restoreInterrupt(t);
      return recovery.apply(translateForRecovery(translator, t, context));
    }
  }

  @Override
  public <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(fallback, "fallback");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      restoreInterrupt(t);
      return fallback.apply(ExceptionUtils.unwrapAsyncException(t));
    }
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      restoreInterrupt(t);
      Throwable primary = translateSafe(customTranslator, t, context);
      log.error("[Task:FAILURE] {} ({})", context.toTaskName(), primary.toString(), primary);
      throwAsUnchecked(primary);
      return null;
    }
  }

  private static void restoreInterrupt(Throwable t) {
    if (ExceptionUtils.unwrapAsyncException(t) instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
  }

  private static Throwable translateSafe(
      ExceptionTranslator customTranslator, Throwable t, TaskContext context) {
    try {
      return customTranslator.translate(t, context);
    } catch (RuntimeException | Error ex) {
      return ex;
    } catch (Throwable unexpected) {
      return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, unexpected);
    }
  }

  private static Throwable translateForRecovery(
      ExceptionTranslator customTranslator, Throwable t, TaskContext context) {
    Throwable translated = translateSafe(customTranslator, t, context);
    if (translated instanceof Error e) {
      throw e;
    }
    return translated;
  }

  private static void throwAsUnchecked(Throwable t) {
    if (t instanceof Error e) throw e;
    if (t instanceof RuntimeException re) throw re;
    throw new IllegalStateException("Unexpected checked throwable", t);
  }
}
