package finewine.acquisition.error.exception.marker;

/** 이 인터페이스를 구현한 예외는 항상 서킷 브레이커 실패로 기록됩니다. */
public interface CircuitBreakerRecordMarker {}
