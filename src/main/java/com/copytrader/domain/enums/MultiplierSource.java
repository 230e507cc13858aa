package com.copytrader.domain.enums;

/** Where an effective multiplier came from. There is no inferred source. */
public enum MultiplierSource {
    BASE,
    USER_OVERRIDE
}
