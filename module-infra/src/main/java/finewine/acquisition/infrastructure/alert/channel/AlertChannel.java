package finewine.acquisition.infrastructure.alert.channel;

import finewine.acquisition.domain.model.alert.Alert;

/** 알림 전달 채널. 실패는 예외 대신 false 로 알립니다. */
public interface AlertChannel {

  boolean send(Alert alert);

  String getChannelName();
}
