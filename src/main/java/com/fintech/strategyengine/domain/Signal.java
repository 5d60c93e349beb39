package com.fintech.strategyengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trade signal produced by a strategy for the latest closed candle.
 */
public enum Signal {

    BUY("buy"),
    SELL("sell"),
    NEUTRAL("neutral");

    private final String code;

    Signal(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Returns true for signals that should reach the order collaborator. */
    public boolean isActionable() {
        return this != NEUTRAL;
    }
}
