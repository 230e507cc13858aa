package com.copytrader.domain.enums;

/** Kind of master-side order event delivered by the master session subscription. */
public enum MasterEventType {
    ACCEPTED,
    CANCELLED,
    REPLACED
}
