package finewine.acquisition.compliance;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** 전체 감사 결과의 최근 이력 (용량 초과 시 오래된 것부터 제거). */
public class ComplianceHistory {

  private final Deque<Entry> entries = new ArrayDeque<>();
  private final int capacity;

  public ComplianceHistory(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
  }

  public synchronized void add(Entry entry) {
    entries.addLast(entry);
    while (entries.size() > capacity) {
      entries.pollFirst();
    }
  }

  public synchronized List<Entry> recent(int limit) {
    List<Entry> all = new ArrayList<>(entries);
    return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
  }

  public synchronized int size() {
    return entries.size();
  }

  /**
   * @param reportId 감사 보고서 생성 시각 (ISO-8601)
   * @param reportFile 저장된 보고서 경로
   */
  public record Entry(
      Instant timestamp, String type, String status, int criticalIssuesCount, String reportId,
      String reportFile) {}
}
