package finewine.acquisition.error;

import static org.assertj.core.api.Assertions.assertThat;

import finewine.acquisition.error.exception.InternalSystemException;
import finewine.acquisition.error.exception.base.BaseException;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

@Tag("unit")
class CommonErrorCodeTest {

  @Test
  @DisplayName("에러 코드는 중복되지 않는다")
  void codesAreUnique() {
    Set<String> codes =
        Arrays.stream(CommonErrorCode.values())
            .map(CommonErrorCode::getCode)
            .collect(Collectors.toSet());

    assertThat(codes).hasSize(CommonErrorCode.values().length);
  }

  @Test
  @DisplayName("C 코드는 4xx, S 코드는 5xx 상태를 가진다")
  void prefixMatchesStatusSeries() {
    for (CommonErrorCode code : CommonErrorCode.values()) {
      HttpStatus status = code.getStatus();
      if (code.getCode().startsWith("C")) {
        assertThat(status.is4xxClientError()).as(code.name()).isTrue();
      } else {
        assertThat(status.is5xxServerError()).as(code.name()).isTrue();
      }
    }
  }

  @Test
  @DisplayName("동적 인자가 메시지 템플릿에 채워지고 원인이 보존된다")
  void formatsMessageAndKeepsCause() {
    IllegalStateException cause = new IllegalStateException("boom");

    BaseException exception = new InternalSystemException("Fetch:fangraphs", cause);

    assertThat(exception.getMessage()).contains("Fetch:fangraphs");
    assertThat(exception.getCause()).isSameAs(cause);
    assertThat(exception.getErrorCode()).isEqualTo(CommonErrorCode.INTERNAL_SERVER_ERROR);
  }
}
