package finewine.acquisition.infrastructure.alert.channel;

import finewine.acquisition.domain.model.alert.Alert;
import finewine.acquisition.infrastructure.alert.message.AlertMessageFormatter;
import finewine.acquisition.infrastructure.executor.LogicExecutor;
import finewine.acquisition.infrastructure.executor.TaskContext;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import lombok.extern.slf4j.Slf4j;

/** 로컬 파일에 알림을 한 줄씩 append 합니다. webhook 전달 실패 시의 최종 fallback. */
@Slf4j
public class LocalFileAlertChannel implements AlertChannel {

  private final Path logFilePath;
  private final LogicExecutor executor;

  public LocalFileAlertChannel(Path logFilePath, LogicExecutor executor) {
    this.logFilePath = logFilePath;
    this.executor = executor;
  }

  @Override
  public boolean send(Alert alert) {
    return executor.executeWithFallback(
        () -> append(alert),
        e -> {
          log.error(
              "[LocalFileAlertChannel] Failed to write alert to file: {} ({})",
              logFilePath,
              e.getMessage());
          return false;
        },
        TaskContext.of("AlertChannel", "LocalFile", logFilePath.toString()));
  }

  private synchronized boolean append(Alert alert) throws IOException {
    Path parent = logFilePath.toAbsolutePath().getParent();
    if (parent != null && Files.notExists(parent)) {
      Files.createDirectories(parent);
    }
    Files.writeString(
        logFilePath,
        AlertMessageFormatter.toLine(alert) + System.lineSeparator(),
        StandardCharsets.UTF_8,
        StandardOpenOption.CREATE,
        StandardOpenOption.WRITE,
        StandardOpenOption.APPEND);
    return true;
  }

  @Override
  public String getChannelName() {
    return "local-file";
  }

  public Path getLogFilePath() {
    return logFilePath;
  }
}
