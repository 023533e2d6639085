package finewine.acquisition.core.port.out;

import finewine.acquisition.domain.model.fetch.FetchRequest;
import finewine.acquisition.domain.model.source.Capability;
import finewine.acquisition.domain.model.source.SourceId;

/**
 * 소스별 fetch 함수 포트.
 *
 * <p>module-infra 의 HTTP 어댑터나 테스트용 람다가 구현합니다. 구현체는 2xx 가 아닌 응답을 {@code
 * ProviderResponseException} 으로, 전송 오류는 원래 예외(IOException, TimeoutException 등)로 던져야 합니다.
 *
 * <p>호출은 fetch 전용 스레드에서 실행되며, 타임아웃 시 인터럽트될 수 있습니다.
 */
public interface SourceFetcher {

  SourceId sourceId();

  /**
   * @return 제공자별 페이로드 (해석은 호출자 책임)
   * @throws Exception 전송 오류 또는 비정상 응답
   */
  Object fetch(Capability capability, FetchRequest request) throws Exception;
}
