package com.copytrader.domain.enums;

public enum NotificationKind {
    SHORT_SALE_TASK,
    ORDER_REPLICATION,
    ACTION_QUEUED,
    ACTIONS_REPLAYED,
    QUEUED_ACTIONS_AVAILABLE,
    RECONCILIATION,
    ENGINE_STATE
}
