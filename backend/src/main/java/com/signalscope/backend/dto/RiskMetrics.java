package com.signalscope.backend.dto;

/**
 * Trade-quality figures for the daily series. Percentages are in percent units; {@code maxDrawdown} is
 * reported as a non-positive number.
 */
public record RiskMetrics(
        double expectedReturn,
        double sharpeRatio,
        double maxDrawdown,
        double volatility,
        double riskRewardRatio,
        double winRate
) {
    public static RiskMetrics neutral() {
        return new RiskMetrics(0, 0, 0, 0, 0, 0);
    }
}
