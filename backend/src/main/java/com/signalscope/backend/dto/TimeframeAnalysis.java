package com.signalscope.backend.dto;

import com.signalscope.backend.model.Timeframe;

/**
 * Full per-timeframe output: the indicator and pattern bundles plus the condensed result. A degenerate entry
 * carries neutral bundles because its series was too short.
 */
public record TimeframeAnalysis(
        Timeframe timeframe,
        int candleCount,
        boolean degenerate,
        IndicatorSet indicators,
        PatternAnalysis patterns,
        TimeframeResult result
) {}
