package com.copytrader.domain.enums;

/** Order types carried over verbatim from the master order to each follower order. */
public enum OrderType {
    MARKET,
    LIMIT,
    STOP,
    STOP_LIMIT,
    TRAILING_STOP
}
