package finewine.acquisition.compliance.policy;

import finewine.acquisition.domain.model.source.SourceId;
import java.math.BigDecimal;

/**
 * 소스별 과금 정책.
 *
 * @param monthlyLimit 월간 요청 한도, 없으면 null
 * @param free 무료 소스 여부 (비용이 발생하면 이상 징후)
 */
public record CostPolicy(SourceId source, BigDecimal costPerRequest, Long monthlyLimit, boolean free) {

  public CostPolicy {
    costPerRequest = costPerRequest == null ? BigDecimal.ZERO : costPerRequest;
  }

  public static CostPolicy free(SourceId source) {
    return new CostPolicy(source, BigDecimal.ZERO, null, true);
  }

  public BigDecimal costOf(long requests) {
    return costPerRequest.multiply(BigDecimal.valueOf(requests));
  }
}
