package com.copytrader.domain.enums;

public enum QueuedActionType {
    SUBMIT,
    CANCEL,
    REPLACE
}
