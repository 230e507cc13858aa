package com.copytrader.domain.enums;

/**
 * Multiplier half of a confirmed reconciliation decision. The blacklist half is a separate flag.
 * <ul>
 *   <li>USE_INFERRED, MANUAL -- set a symbol override to the supplied multiplier</li>
 *   <li>USE_DEFAULT -- clear any symbol override so the base multiplier applies</li>
 *   <li>KEEP -- leave the multiplier untouched</li>
 * </ul>
 */
public enum DecisionAction {
    USE_INFERRED,
    MANUAL,
    USE_DEFAULT,
    KEEP
}
