package finewine.acquisition.infrastructure.executor.function;

/**
 * checked 예외만 던지는 공급자. 브레이커가 보호하는 연산의 시그니처입니다.
 *
 * <p>{@link ThrowingSupplier} 와 달리 {@link Error} 는 계약에 포함하지 않습니다.
 */
@FunctionalInterface
public interface CheckedSupplier<T> {
  T get() throws Exception;
}
