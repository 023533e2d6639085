package finewine.acquisition.domain.model.source;

import java.util.Objects;

/** 소스가 제공하는 데이터 종류. 예: {@code player_stats}, {@code prospect_rankings} */
public record Capability(String value) {

  public Capability {
    Objects.requireNonNull(value, "Capability value cannot be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException("Capability value cannot be blank");
    }
  }

  public static Capability of(String value) {
    return new Capability(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
