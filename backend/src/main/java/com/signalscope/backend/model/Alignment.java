package com.signalscope.backend.model;

public enum Alignment {
    BULLISH,
    BEARISH,
    NEUTRAL,
    MIXED
}
