package com.copytrader.domain.enums;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
