package finewine.acquisition.core.port.out;

import finewine.acquisition.domain.model.fetch.FetchOutcome;

/** 모니터가 기록한 시도 결과를 추가로 구독하는 리스너 (비용 집계 등). */
@FunctionalInterface
public interface FetchOutcomeListener {

  void onOutcome(FetchOutcome outcome);
}
