package com.signalscope.backend.model;

public enum TrendDirection {
    UPTREND,
    DOWNTREND,
    SIDEWAYS;

    public Bias toBias() {
        return switch (this) {
            case UPTREND -> Bias.BULLISH;
            case DOWNTREND -> Bias.BEARISH;
            case SIDEWAYS -> Bias.NEUTRAL;
        };
    }

    public String label() {
        return name().toLowerCase();
    }
}
