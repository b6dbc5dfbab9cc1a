package com.signalscope.backend.model;

public enum RsiZone {
    OVERSOLD,
    NEUTRAL,
    OVERBOUGHT
}
