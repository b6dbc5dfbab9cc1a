package com.signalscope.backend.model;

public enum BollingerPosition {
    ABOVE_UPPER,
    UPPER_HALF,
    MIDDLE,
    LOWER_HALF,
    BELOW_LOWER
}
