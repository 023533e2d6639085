package finewine.acquisition.compliance.policy;

import finewine.acquisition.domain.model.source.SourceId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.web.util.HtmlUtils;

/** 출처 표기 정책 조회와 HTML 렌더링. */
public class AttributionRegistry {

  private final Map<SourceId, AttributionPolicy> policies;

  public AttributionRegistry(Map<SourceId, AttributionPolicy> policies) {
    this.policies = Map.copyOf(policies);
  }

  public Optional<AttributionPolicy> find(SourceId source) {
    return Optional.ofNullable(policies.get(source));
  }

  /**
   * 출처 표기 HTML. 정책이 없거나 표기가 필요 없으면 빈 문자열입니다.
   *
   * <pre>{@code <div class="data-attribution"><a href="..." target="_blank">text</a></div>}</pre>
   */
  public String renderHtml(SourceId source) {
    AttributionPolicy policy = policies.get(source);
    if (policy == null || !policy.required() || isBlank(policy.text())) {
      return "";
    }
    String text = HtmlUtils.htmlEscape(policy.text());
    if (!isBlank(policy.url()) && policy.linkRequired()) {
      return "<div class=\"data-attribution\"><a href=\""
          + HtmlUtils.htmlEscape(policy.url())
          + "\" target=\"_blank\">"
          + text
          + "</a></div>";
    }
    return "<div class=\"data-attribution\">" + text + "</div>";
  }

  /** 등록된 소스 하나에 대한 누락 사항. 표기가 필요 없는 소스는 항상 빈 목록입니다. */
  public List<String> issuesFor(SourceId source) {
    AttributionPolicy policy = policies.get(source);
    if (policy == null) {
      return List.of("Missing attribution policy for " + source);
    }
    if (!policy.required()) {
      return List.of();
    }
    List<String> issues = new ArrayList<>();
    if (isBlank(policy.text())) {
      issues.add("Missing attribution text for " + source);
    }
    if (isBlank(policy.position())) {
      issues.add("Missing display position for " + source);
    }
    if (isBlank(policy.visibility())) {
      issues.add("Missing visibility requirement for " + source);
    }
    if (policy.linkRequired() && isBlank(policy.url())) {
      issues.add("Missing attribution link for " + source);
    }
    if (renderHtml(source).isEmpty()) {
      issues.add("Failed to generate attribution HTML for " + source);
    }
    return issues;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
