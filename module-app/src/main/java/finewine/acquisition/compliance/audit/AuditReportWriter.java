package finewine.acquisition.compliance.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import finewine.acquisition.domain.exception.ComplianceReportException;
import finewine.acquisition.infrastructure.executor.LogicExecutor;
import finewine.acquisition.infrastructure.executor.TaskContext;
import finewine.acquisition.infrastructure.executor.strategy.ExceptionTranslator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** 감사 보고서를 {@code <reportsDir>/compliance_audit_yyyyMMdd_HHmmss.json} 으로 저장합니다 (UTC). */
@Slf4j
@RequiredArgsConstructor
public class AuditReportWriter {

  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private final ObjectMapper objectMapper;
  private final Path reportsDir;
  private final LogicExecutor executor;

  /**
   * @return 저장된 파일 경로
   * @throws ComplianceReportException 디렉터리 생성 또는 쓰기 실패
   */
  public Path write(AuditReport report) {
    Path file = reportsDir.resolve(fileName(report));
    return executor.executeWithTranslation(
        () -> {
          Files.createDirectories(reportsDir);
          objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
          log.info("[AuditReport] Audit report saved to {}", file);
          return file;
        },
        ExceptionTranslator.forReportIo(),
        TaskContext.of("AuditReportWriter", "Write", file.toString()));
  }

  static String fileName(AuditReport report) {
    return "compliance_audit_" + FILE_TIMESTAMP.format(report.generatedAt()) + ".json";
  }
}
