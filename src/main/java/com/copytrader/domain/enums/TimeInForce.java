package com.copytrader.domain.enums;

public enum TimeInForce {
    DAY,
    GTC,
    IOC,
    FOK
}
