package com.signalscope.backend.dto;

import com.signalscope.backend.model.Recommendation;

import java.time.LocalDate;

/**
 * Final record of one analysis request. {@code finalScore} is the confidence score after the conflict
 * adjustment.
 */
public record StockAnalysis(
        String symbol,
        LocalDate asOf,
        ComprehensiveTechnicalAnalysis technical,
        ConfidenceResult confidence,
        ConflictResult conflict,
        RiskMetrics riskMetrics,
        int finalScore,
        Recommendation finalRecommendation
) {}
