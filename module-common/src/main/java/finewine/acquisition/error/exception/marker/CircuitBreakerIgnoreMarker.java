package finewine.acquisition.error.exception.marker;

/** 이 인터페이스를 구현한 예외는 서킷 브레이커의 실패 카운트에 포함되지 않습니다. */
public interface CircuitBreakerIgnoreMarker {}
