package finewine.acquisition.infrastructure.executor.function;

@FunctionalInterface
public interface ThrowingRunnable {
  void run() throws Throwable;
}
