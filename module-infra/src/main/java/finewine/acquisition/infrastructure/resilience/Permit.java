package finewine.acquisition.infrastructure.resilience;

import finewine.acquisition.domain.model.source.SourceId;

/**
 * 브레이커가 발급한 호출 허가.
 *
 * <p>{@code generation} 은 허가 시점의 상태 세대입니다. 이후 상태가 전이되었다면 결과 보고는 통계에만 반영되고 상태 기계에는 영향을
 * 주지 않습니다. 늦게 도착한 결과가 새 HALF_OPEN 프로브로 오인되는 것을 막습니다.
 */
public record Permit(SourceId source, long generation, boolean probe) {}
