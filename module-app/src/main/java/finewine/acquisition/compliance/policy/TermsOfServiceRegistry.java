package finewine.acquisition.compliance.policy;

import finewine.acquisition.domain.model.source.RateLimitSpec;
import finewine.acquisition.domain.model.source.SourceId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class TermsOfServiceRegistry {

  private final Map<SourceId, TermsOfService> terms;

  public TermsOfServiceRegistry(Map<SourceId, TermsOfService> terms) {
    this.terms = Map.copyOf(terms);
  }

  public Optional<TermsOfService> find(SourceId source) {
    return Optional.ofNullable(terms.get(source));
  }

  public Optional<RateLimitSpec> declaredRateLimit(SourceId source) {
    return find(source).flatMap(TermsOfService::declaredRateLimit);
  }

  public boolean isAccepted(SourceId source) {
    return find(source).map(TermsOfService::accepted).orElse(false);
  }

  public List<String> issuesFor(SourceId source) {
    TermsOfService tos = terms.get(source);
    if (tos == null) {
      return List.of("Missing ToS requirements for " + source);
    }
    List<String> issues = new ArrayList<>();
    if (!tos.accepted()) {
      issues.add("ToS not accepted for " + source);
    }
    if (tos.version() == null || tos.version().isBlank()) {
      issues.add("ToS version not recorded for " + source);
    }
    return issues;
  }
}
