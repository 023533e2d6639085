/**
 * 수집 도메인 예외.
 *
 * <p>모두 module-common 의 {@code ClientBaseException}(4xx) 또는 {@code ServerBaseException}(5xx) 을 상속하며
 * {@code CommonErrorCode} 로 코드/메시지를 정의합니다. 시도 단위 실패는 예외가 아니라 {@code OutcomeKind} 로 표현하고, 여기의 예외는
 * 호출자에게 노출되는 경우에만 사용합니다.
 */
package finewine.acquisition.domain.exception;
