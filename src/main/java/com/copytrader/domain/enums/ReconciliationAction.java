package com.copytrader.domain.enums;

/** Default action proposed for a reconciliation entry, before the user confirms. */
public enum ReconciliationAction {
    USE_INFERRED,
    BLACKLIST
}
