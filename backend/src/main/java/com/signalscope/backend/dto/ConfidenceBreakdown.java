package com.signalscope.backend.dto;

/**
 * The five 0-100 sub-scores behind a confidence score.
 */
public record ConfidenceBreakdown(
        int patternStrength,
        int newsSentiment,
        int technicalAlignment,
        int volumeConfirmation,
        int fundamentalStrength
) {}
