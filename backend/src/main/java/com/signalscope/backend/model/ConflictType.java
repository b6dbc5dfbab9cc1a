package com.signalscope.backend.model;

public enum ConflictType {
    NONE,
    OVERVALUED_BULLISH,
    UNDERVALUED_BEARISH,
    WEAK_GROWTH_BULLISH
}
