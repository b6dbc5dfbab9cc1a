package com.signalscope.backend.model;

public enum SectorComparison {
    OUTPERFORMING,
    INLINE,
    UNDERPERFORMING,
    UNKNOWN
}
