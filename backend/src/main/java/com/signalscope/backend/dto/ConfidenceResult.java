package com.signalscope.backend.dto;

import com.signalscope.backend.model.Recommendation;

import java.util.List;

public record ConfidenceResult(
        int score,
        ConfidenceBreakdown breakdown,
        List<String> factors,
        Recommendation recommendation,
        DirectionResult direction
) {}
