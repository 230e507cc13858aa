package com.copytrader.domain.enums;

/**
 * Side of a master or follower order. SHORT_SELL is distinguished from SELL because a short
 * sale on a follower goes through borrow acquisition before it is placed.
 */
public enum OrderSide {
    BUY,
    SELL,
    SHORT_SELL;

    public boolean isShort() {
        return this == SHORT_SELL;
    }
}
