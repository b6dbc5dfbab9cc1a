package com.signalscope.backend.dto;

import com.signalscope.backend.model.PatternKind;
import com.signalscope.backend.model.TrendDirection;

import java.util.List;

public record TimeframeResult(
        List<PatternKind> patternNames,
        TrendDirection trend,
        int strength,
        double support,
        double resistance
) {
    public static TimeframeResult degenerate() {
        return new TimeframeResult(List.of(), TrendDirection.SIDEWAYS, 0, 0.0, 0.0);
    }
}
