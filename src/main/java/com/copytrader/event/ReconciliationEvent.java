package com.copytrader.event;

import com.copytrader.domain.model.ReconciliationApplyResult;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per connect cycle when the reconciliation gate opens, either by applying
 * decisions or by an explicit skip. {@code result} is null for a skip.
 */
public class ReconciliationEvent extends ApplicationEvent {

    private final ReconciliationApplyResult result;
    private final boolean skipped;
    private final Instant openedAt;

    public ReconciliationEvent(Object source, ReconciliationApplyResult result, boolean skipped) {
        super(source);
        this.result = result;
        this.skipped = skipped;
        this.openedAt = Instant.now();
    }

    public ReconciliationApplyResult getResult() {
        return result;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }
}
