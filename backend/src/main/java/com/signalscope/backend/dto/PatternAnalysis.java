package com.signalscope.backend.dto;

import java.util.List;

public record PatternAnalysis(
        PatternMatch primary,
        List<PatternMatch> secondary,
        TrendResult trend,
        boolean atBreakout,
        boolean atBreakdown
) {
    public static PatternAnalysis empty() {
        return new PatternAnalysis(null, List.of(), TrendResult.sideways(), false, false);
    }

    public boolean hasPrimary() {
        return primary != null;
    }
}
