package finewine.acquisition.domain.model.source;

import java.util.Objects;

/** 데이터 소스 식별자 (Value Object). 예: {@code fangraphs}, {@code mlb_api} */
public record SourceId(String value) {

  public SourceId {
    Objects.requireNonNull(value, "SourceId value cannot be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException("SourceId value cannot be blank");
    }
  }

  public static SourceId of(String value) {
    return new SourceId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
