package com.signalscope.backend.dto;

import com.signalscope.backend.model.Agreement;
import com.signalscope.backend.model.Bias;

/**
 * Agreement of the primary chart patterns across the three timeframes.
 */
public record PatternConfluence(
        Agreement agreement,
        Bias dominantBias,
        int bullishVotes,
        int bearishVotes,
        int score,
        int confidenceModifier,
        String recommendation
) {}
