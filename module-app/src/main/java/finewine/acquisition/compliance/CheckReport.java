package finewine.acquisition.compliance;

import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.domain.model.compliance.CheckId;
import java.util.List;

/**
 * 점검 1회의 발견 사항.
 *
 * @param severity 이 결과로 보낼 알림 등급. 문제가 없으면 보통 INFO
 * @param alert false 면 알림 없이 로그만 남김 (문제 없는 정기 점검)
 */
public record CheckReport(
    CheckId check, AlertSeverity severity, String summary, List<String> issues, boolean alert) {

  public CheckReport {
    issues = List.copyOf(issues);
  }

  public static CheckReport passed(CheckId check, String summary) {
    return new CheckReport(check, AlertSeverity.INFO, summary, List.of(), false);
  }

  public static CheckReport info(CheckId check, String summary) {
    return new CheckReport(check, AlertSeverity.INFO, summary, List.of(), true);
  }

  /** issues 가 비어 있으면 {@link #passed} 와 같습니다. */
  public static CheckReport withIssues(
      CheckId check, AlertSeverity severity, String summary, List<String> issues) {
    if (issues.isEmpty()) {
      return passed(check, summary);
    }
    return new CheckReport(check, severity, summary, issues, true);
  }

  public boolean hasIssues() {
    return !issues.isEmpty();
  }

  public String toAlertMessage() {
    if (issues.isEmpty()) {
      return summary;
    }
    return summary + ": " + String.join(", ", issues);
  }
}
