package finewine.acquisition.infrastructure.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** 예외 체인 유틸리티. */
public final class ExceptionUtils {

  private static final int MAX_CAUSE_DEPTH = 16;

  /** CompletionException / ExecutionException 래퍼를 벗겨 실제 원인을 반환합니다. 원인이 없으면 입력 그대로. */
  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable cause = throwable;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      cause = cause.getCause();
      if (cause == null) {
        return throwable;
      }
    }
    return cause;
  }

  /** 원인 체인에서 주어진 타입을 찾습니다 (순환 체인 방지를 위해 깊이 제한). */
  public static <T extends Throwable> T findCause(Throwable throwable, Class<T> type) {
    Throwable current = throwable;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (type.isInstance(current)) {
        return type.cast(current);
      }
      current = current.getCause();
    }
    return null;
  }

  /** 로그/알림용 한 줄 요약: "SimpleName: message" */
  public static String describe(Throwable throwable) {
    if (throwable == null) {
      return "unknown";
    }
    String message = throwable.getMessage();
    String name = throwable.getClass().getSimpleName();
    return message == null || message.isBlank() ? name : name + ": " + message;
  }

  private ExceptionUtils() {}
}
