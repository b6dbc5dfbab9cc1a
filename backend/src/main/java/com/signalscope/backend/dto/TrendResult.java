package com.signalscope.backend.dto;

import com.signalscope.backend.model.TrendDirection;

public record TrendResult(TrendDirection direction, int strength, boolean consolidating) {

    public static TrendResult sideways() {
        return new TrendResult(TrendDirection.SIDEWAYS, 0, false);
    }
}
