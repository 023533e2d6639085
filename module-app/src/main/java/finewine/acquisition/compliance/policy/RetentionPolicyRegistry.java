package finewine.acquisition.compliance.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** 데이터 그룹 → 분류 → 보존 정책. 조회 순서는 이름순으로 고정합니다. */
public class RetentionPolicyRegistry {

  private final List<RetentionPolicy> policies;

  public RetentionPolicyRegistry(List<RetentionPolicy> policies) {
    this.policies = List.copyOf(policies);
  }

  public static RetentionPolicyRegistry fromConfig(Map<String, Map<String, String>> config) {
    List<RetentionPolicy> parsed = new ArrayList<>();
    new TreeMap<>(config)
        .forEach(
            (dataType, categories) ->
                new TreeMap<>(categories)
                    .forEach(
                        (category, value) ->
                            parsed.add(RetentionPolicy.parse(dataType, category, value))));
    return new RetentionPolicyRegistry(parsed);
  }

  public List<RetentionPolicy> all() {
    return policies;
  }

  public List<RetentionPolicy> finite() {
    return policies.stream().filter(RetentionPolicy::isFinite).toList();
  }

  /** 보고서용: 데이터 그룹 → (분류 → "N days" | "indefinite") */
  public Map<String, Map<String, String>> describeAll() {
    Map<String, Map<String, String>> grouped = new LinkedHashMap<>();
    for (RetentionPolicy policy : policies) {
      grouped
          .computeIfAbsent(policy.dataType(), type -> new LinkedHashMap<>())
          .put(policy.category(), policy.describe());
    }
    grouped.replaceAll((type, categories) -> Collections.unmodifiableMap(categories));
    return Collections.unmodifiableMap(grouped);
  }
}
