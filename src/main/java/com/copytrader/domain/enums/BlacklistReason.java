package com.copytrader.domain.enums;

/** Informational only; the reason never changes how a blacklist entry behaves. */
public enum BlacklistReason {
    MANUAL,
    LOCATE_REJECTED,
    RECONCILIATION
}
