package finewine.acquisition.infrastructure.alert.strategy;

import finewine.acquisition.domain.model.alert.AlertSeverity;
import finewine.acquisition.infrastructure.alert.channel.AlertChannel;
import java.util.List;

/** 심각도별 전달 채널 체인. 앞의 채널이 실패하면 다음 채널로 넘어갑니다. */
public interface AlertChannelStrategy {

  List<AlertChannel> getChannels(AlertSeverity severity);
}
