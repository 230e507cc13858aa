package com.copytrader.domain.enums;

/**
 * Lifecycle of the replication engine.
 *
 * <pre>
 * STOPPED -> CONNECTED -> REPLICATING
 *    ^           |             |
 *    +-----------+-------------+  (stop or scheduled restart)
 * </pre>
 *
 * <p>CONNECTED means every broker session is live but no master event is dispatched;
 * the engine waits here for reconciliation to be applied or skipped.
 */
public enum EngineState {
    STOPPED,
    CONNECTED,
    REPLICATING
}
