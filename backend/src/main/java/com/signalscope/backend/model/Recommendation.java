package com.signalscope.backend.model;

public enum Recommendation {
    BUY,
    SELL,
    HOLD,
    WAIT
}
