package com.signalscope.backend.dto;

import com.signalscope.backend.model.FundamentalData;
import com.signalscope.backend.model.NewsSentiment;

/**
 * Everything the confidence scorer reads. Indicators and patterns come from the primary (daily) timeframe.
 */
public record ConfidenceInput(
        PatternAnalysis patterns,
        IndicatorSet indicators,
        AlignmentResult alignment,
        NewsSentiment news,
        FundamentalData fundamentals
) {}
