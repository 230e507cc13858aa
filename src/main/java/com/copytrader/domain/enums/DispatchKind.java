package com.copytrader.domain.enums;

import com.copytrader.domain.model.MasterOrderEvent;

/**
 * Dispatch variant of a master event, resolved once when the engine picks the event up.
 * Downstream code switches on this value instead of re-inspecting side and type.
 */
public enum DispatchKind {
    PLAIN_SUBMIT,
    SHORT_SALE_SUBMIT,
    CANCEL,
    REPLACE;

    public static DispatchKind of(MasterOrderEvent event) {
        return switch (event.getType()) {
            case ACCEPTED -> event.getSide().isShort() ? SHORT_SALE_SUBMIT : PLAIN_SUBMIT;
            case CANCELLED -> CANCEL;
            case REPLACED -> REPLACE;
        };
    }

    public boolean isSubmit() {
        return this == PLAIN_SUBMIT || this == SHORT_SALE_SUBMIT;
    }
}
