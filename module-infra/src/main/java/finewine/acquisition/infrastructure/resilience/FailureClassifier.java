package finewine.acquisition.infrastructure.resilience;

/** 소스별로 교체 가능한 실패 분류 전략. */
@FunctionalInterface
public interface FailureClassifier {

  Classification classify(Throwable error);
}
