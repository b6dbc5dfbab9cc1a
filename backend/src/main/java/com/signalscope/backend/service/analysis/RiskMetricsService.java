package com.signalscope.backend.service.analysis;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.dto.IndicatorSet;
import com.signalscope.backend.dto.RiskMetrics;
import com.signalscope.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class RiskMetricsService {

    private final AnalysisProperties analysisProperties;

    /**
     * Volatility and drawdown come from the close series. Expected return, risk/reward and Sharpe assume a
     * target and a stop sized in ATR multiples, with a win rate derived from the adjusted confidence.
     */
    public RiskMetrics calculateRiskMetrics(List<Candle> candles, IndicatorSet indicators, int adjustedConfidence) {
        AnalysisProperties.Risk config = analysisProperties.getRisk();
        if (candles == null || candles.size() < config.getMinCandles()) {
            return RiskMetrics.neutral();
        }

        double volatility = annualizedVolatility(candles, config.getTradingDaysPerYear());
        double maxDrawdown = maxDrawdownPercent(candles);
        double winRate = Math.max(config.getMinWinRate(), Math.min(config.getMaxWinRate(),
                config.getWinRateBase() + adjustedConfidence * config.getWinRatePerConfidencePoint()));

        double atr = indicators == null ? 0.0 : indicators.atr().atr();
        double price = candles.get(candles.size() - 1).getClose();
        double gainPercent = price > 0 ? atr * config.getTargetAtrMultiple() / price * 100 : 0.0;
        double lossPercent = price > 0 ? atr * config.getStopAtrMultiple() / price * 100 : 0.0;

        double winFraction = winRate / 100;
        double expectedReturn = winFraction * gainPercent - (1 - winFraction) * lossPercent;
        double riskReward = lossPercent > 0 ? gainPercent / lossPercent : 0.0;
        double sharpe = volatility > 0
                ? (expectedReturn * config.getTradingDaysPerYear() - config.getRiskFreeRatePercent()) / volatility
                : 0.0;

        return new RiskMetrics(expectedReturn, sharpe, -maxDrawdown, volatility, riskReward, winRate);
    }

    private static double annualizedVolatility(List<Candle> candles, int tradingDays) {
        double sum = 0;
        double sumSquares = 0;
        int count = 0;
        for (int i = 1; i < candles.size(); i++) {
            double previous = candles.get(i - 1).getClose();
            if (previous <= 0) {
                continue;
            }
            double change = (candles.get(i).getClose() - previous) / previous;
            sum += change;
            sumSquares += change * change;
            count++;
        }
        if (count == 0) {
            return 0.0;
        }
        double mean = sum / count;
        double variance = Math.max(0.0, sumSquares / count - mean * mean);
        return Math.sqrt(variance) * Math.sqrt(tradingDays) * 100;
    }

    private static double maxDrawdownPercent(List<Candle> candles) {
        double peak = candles.get(0).getClose();
        double worst = 0;
        for (Candle candle : candles) {
            peak = Math.max(peak, candle.getClose());
            if (peak > 0) {
                worst = Math.max(worst, (peak - candle.getClose()) / peak * 100);
            }
        }
        return worst;
    }
}
