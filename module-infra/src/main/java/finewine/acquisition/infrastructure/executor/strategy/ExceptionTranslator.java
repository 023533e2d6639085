package finewine.acquisition.infrastructure.executor.strategy;

import finewine.acquisition.domain.exception.ComplianceReportException;
import finewine.acquisition.error.exception.InternalSystemException;
import finewine.acquisition.error.exception.base.BaseException;
import finewine.acquisition.infrastructure.executor.TaskContext;
import finewine.acquisition.infrastructure.util.ExceptionUtils;
import java.io.IOException;

/** 작업 실패를 도메인 예외로 번역하는 전략. */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e, TaskContext context);

  /** Error 는 던지고, 비동기 래퍼를 벗긴 뒤, 이미 도메인 예외면 그대로 통과시킵니다. */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /** 리포트 파일 I/O 실패를 {@link ComplianceReportException} 으로 번역 */
  static ExceptionTranslator forReportIo() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof IOException) {
            return new ComplianceReportException(context.dynamicValue(), unwrapped);
          }
          return new InternalSystemException("report-io:" + context.toTaskName(), unwrapped);
        });
  }
}
