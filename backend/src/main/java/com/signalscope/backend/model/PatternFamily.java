package com.signalscope.backend.model;

public enum PatternFamily {
    CANDLESTICK,
    CHART,
    MOVING_AVERAGE
}
