package com.copytrader.domain.enums;

/**
 * Failure taxonomy attached to status notifications.
 * CANCELLATION and CONFIGURATION are not errors and never raise an alert.
 */
public enum ErrorCategory {

    /** Follower unreachable; the action is queued. */
    CONNECTIVITY,

    /** Not enough borrow even after a locate attempt. */
    CAPACITY,

    /** Broker rejected a submit, cancel or replace. */
    REJECTION,

    CANCELLATION,

    /** Blacklisted symbol or disabled follower. */
    CONFIGURATION;

    public boolean isAlerting() {
        return this == CONNECTIVITY || this == CAPACITY || this == REJECTION;
    }
}
