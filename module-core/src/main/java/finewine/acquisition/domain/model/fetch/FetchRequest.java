package finewine.acquisition.domain.model.fetch;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** fetch 함수에 전달되는 불투명한 요청 파라미터 (예: player_id, season). */
public record FetchRequest(Map<String, String> params) {

  private static final FetchRequest EMPTY = new FetchRequest(Map.of());

  public FetchRequest {
    params = params == null ? Map.of() : Map.copyOf(params);
  }

  public static FetchRequest empty() {
    return EMPTY;
  }

  public static FetchRequest of(String key, String value) {
    return new FetchRequest(Map.of(key, value));
  }

  public static FetchRequest of(String k1, String v1, String k2, String v2) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put(k1, v1);
    params.put(k2, v2);
    return new FetchRequest(params);
  }

  public Optional<String> param(String key) {
    return Optional.ofNullable(params.get(key));
  }
}
