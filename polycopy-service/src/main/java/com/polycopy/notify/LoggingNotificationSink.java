package com.polycopy.notify;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingNotificationSink implements NotificationSink {

  @Override
  public void publish(CopyTradeNotification n) {
    switch (n.kind()) {
      case MIRROR_ERROR -> log.warn("[{}] user={} trade={}:{} market={} detail={}",
          n.kind(), n.userId(), n.sourceWallet(), n.txHash(), n.marketId(), n.detail());
      case POINTS_GRANTED -> log.info("[{}] user={} points={} trade={}:{} {}",
          n.kind(), n.userId(), n.points(), n.sourceWallet(), n.txHash(), n.detail());
      default -> log.info("[{}] user={} trade={}:{} {} {} @ {} market={} {}",
          n.kind(), n.userId(), n.sourceWallet(), n.txHash(), n.side(), n.size(), n.price(), n.marketId(),
          n.detail() == null ? "" : n.detail());
    }
  }
}
