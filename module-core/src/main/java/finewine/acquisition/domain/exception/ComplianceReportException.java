package finewine.acquisition.domain.exception;

import finewine.acquisition.error.CommonErrorCode;
import finewine.acquisition.error.exception.base.ServerBaseException;

public class ComplianceReportException extends ServerBaseException {

  public ComplianceReportException(String target, Throwable cause) {
    super(CommonErrorCode.COMPLIANCE_REPORT_FAILED, cause, target);
  }
}
