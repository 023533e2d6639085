package finewine.acquisition.compliance.policy;

import finewine.acquisition.domain.model.source.SourceId;

/**
 * 소스별 출처 표기 요구사항.
 *
 * @param position 표시 위치 (예: footer)
 * @param visibility 가시성 요구 (예: clearly visible)
 * @param linkRequired true 면 출처 문구를 {@code url} 링크로 감싸야 함
 */
public record AttributionPolicy(
    SourceId source,
    boolean required,
    String text,
    String url,
    String position,
    String visibility,
    boolean linkRequired) {}
