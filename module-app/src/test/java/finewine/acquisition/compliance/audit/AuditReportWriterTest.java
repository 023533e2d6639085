package finewine.acquisition.compliance.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import finewine.acquisition.domain.exception.ComplianceReportException;
import finewine.acquisition.infrastructure.executor.DefaultLogicExecutor;
import finewine.acquisition.infrastructure.executor.strategy.ExceptionTranslator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
class AuditReportWriterTest {

  private static final Instant GENERATED_AT = Instant.parse("2026-04-05T09:30:15Z");

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper =
      new ObjectMapper()
          .findAndRegisterModules()
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private AuditReportWriter writer(Path reportsDir) {
    return new AuditReportWriter(
        objectMapper, reportsDir, new DefaultLogicExecutor(ExceptionTranslator.defaultTranslator()));
  }

  private static AuditReport report() {
    SourceAudit fangraphs =
        new SourceAudit(
            "fangraphs",
            false,
            List.of("ToS not accepted for fangraphs"),
            true,
            "CLOSED",
            true,
            GENERATED_AT.minusSeconds(60),
            0,
            0.0,
            "<div class=\"data-attribution\">FanGraphs</div>");
    return new AuditReport(
        GENERATED_AT,
        Map.of("fangraphs", fangraphs),
        Map.of("prospect_data", Map.of("raw_stats", "30 days")),
        List.of("Review and fix compliance issues immediately"));
  }

  @Test
  @DisplayName("생성 시각(UTC)으로 이름 붙인 JSON 파일을 하위 디렉터리까지 만들어 저장한다")
  void writesTimestampedFile() throws Exception {
    Path reportsDir = tempDir.resolve("compliance_reports");

    Path file = writer(reportsDir).write(report());

    assertThat(file).isEqualTo(reportsDir.resolve("compliance_audit_20260405_093015.json"));
    JsonNode json = objectMapper.readTree(Files.readString(file));
    assertThat(json.get("generatedAt").asText()).isEqualTo("2026-04-05T09:30:15Z");
    assertThat(json.at("/sources/fangraphs/compliant").asBoolean()).isFalse();
    assertThat(json.at("/dataRetention/prospect_data/raw_stats").asText()).isEqualTo("30 days");
    assertThat(json.has("criticalIssues")).isFalse();
    assertThat(json.has("compliant")).isFalse();
  }

  @Test
  @DisplayName("디렉터리를 만들 수 없으면 ComplianceReportException")
  void failsOnIoError() throws Exception {
    Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");

    assertThatThrownBy(() -> writer(blocker).write(report()))
        .isInstanceOf(ComplianceReportException.class);
  }

  @Test
  @DisplayName("criticalIssues 는 비준수 소스의 위반 사항만 source: issue 형태로 모은다")
  void criticalIssues() {
    assertThat(report().criticalIssues()).containsExactly("fangraphs: ToS not accepted for fangraphs");
    assertThat(report().isCompliant()).isFalse();
  }
}
