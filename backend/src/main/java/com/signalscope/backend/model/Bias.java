package com.signalscope.backend.model;

/**
 * Directional lean. Used both as the polarity of a single pattern and as the net technical bias of a stock.
 */
public enum Bias {
    BULLISH,
    BEARISH,
    NEUTRAL;

    public String label() {
        return name().toLowerCase();
    }
}
