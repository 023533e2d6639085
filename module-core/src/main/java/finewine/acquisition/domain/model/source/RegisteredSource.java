package finewine.acquisition.domain.model.source;

import finewine.acquisition.core.port.out.SourceFetcher;
import java.util.Objects;

/** 정적 설정과 실제 호출 함수를 묶은 소스 등록 단위. */
public record RegisteredSource(SourceDefinition definition, SourceFetcher fetcher) {

  public RegisteredSource {
    Objects.requireNonNull(definition, "definition cannot be null");
    Objects.requireNonNull(fetcher, "fetcher cannot be null");
  }

  public SourceId id() {
    return definition.id();
  }
}
