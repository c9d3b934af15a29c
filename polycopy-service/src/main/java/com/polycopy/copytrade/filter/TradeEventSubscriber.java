package com.polycopy.copytrade.filter;

import com.polycopy.copytrade.model.TradeEvent;

/**
 * Receives every emitted trade exactly once, in emission order. Implementations should hand work off
 * quickly; the filter calls subscribers on the poll thread.
 */
public interface TradeEventSubscriber {

  void onTrade(TradeEvent event);
}
