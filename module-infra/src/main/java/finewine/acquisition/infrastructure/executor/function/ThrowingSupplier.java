package finewine.acquisition.infrastructure.executor.function;

@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}
