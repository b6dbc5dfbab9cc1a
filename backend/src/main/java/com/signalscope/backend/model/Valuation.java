package com.signalscope.backend.model;

public enum Valuation {
    UNDERVALUED,
    FAIR,
    OVERVALUED,
    UNKNOWN
}
