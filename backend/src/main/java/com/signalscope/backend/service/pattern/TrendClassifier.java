package com.signalscope.backend.service.pattern;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.dto.TrendResult;
import com.signalscope.backend.model.Candle;
import com.signalscope.backend.model.TrendDirection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class TrendClassifier {

    private final AnalysisProperties analysisProperties;

    /**
     * Least-squares slope of the recent closes, expressed as a percentage of their mean per period.
     */
    public TrendResult classify(List<Candle> candles) {
        AnalysisProperties.Trend config = analysisProperties.getTrend();
        if (candles == null || candles.size() < config.getMinCandles()) {
            return TrendResult.sideways();
        }
        List<Candle> recent = candles.subList(Math.max(0, candles.size() - config.getLookback()), candles.size());
        int n = recent.size();
        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumX2 = 0;
        for (int i = 0; i < n; i++) {
            double close = recent.get(i).getClose();
            sumX += i;
            sumY += close;
            sumXY += i * close;
            sumX2 += (double) i * i;
        }
        double denominator = n * sumX2 - sumX * sumX;
        double mean = sumY / n;
        if (denominator == 0 || mean == 0) {
            return TrendResult.sideways();
        }
        double slope = (n * sumXY - sumX * sumY) / denominator;
        double slopePercent = slope / mean * 100;

        TrendDirection direction = TrendDirection.SIDEWAYS;
        if (slopePercent > config.getSlopeThresholdPercent()) {
            direction = TrendDirection.UPTREND;
        } else if (slopePercent < -config.getSlopeThresholdPercent()) {
            direction = TrendDirection.DOWNTREND;
        }
        int strength = (int) Math.round(Math.min(Math.abs(slopePercent) * config.getStrengthMultiplier(), 100.0));

        double maxDeviation = 0;
        for (Candle candle : recent) {
            maxDeviation = Math.max(maxDeviation, Math.abs(candle.getClose() - mean));
        }
        boolean consolidating = maxDeviation / mean * 100 < config.getConsolidationBandPercent();
        return new TrendResult(direction, strength, consolidating);
    }

    public boolean isAtBreakout(List<Candle> candles) {
        int lookback = analysisProperties.getTrend().getBreakoutLookback();
        if (candles == null || candles.size() < lookback) {
            return false;
        }
        double high = candles.subList(candles.size() - lookback, candles.size()).stream()
                .mapToDouble(Candle::getHigh).max().orElse(0.0);
        return lastClose(candles) >= high * analysisProperties.getTrend().getBreakoutFactor();
    }

    public boolean isAtBreakdown(List<Candle> candles) {
        int lookback = analysisProperties.getTrend().getBreakoutLookback();
        if (candles == null || candles.size() < lookback) {
            return false;
        }
        double low = candles.subList(candles.size() - lookback, candles.size()).stream()
                .mapToDouble(Candle::getLow).min().orElse(0.0);
        return lastClose(candles) <= low * analysisProperties.getTrend().getBreakdownFactor();
    }

    private static double lastClose(List<Candle> candles) {
        return candles.get(candles.size() - 1).getClose();
    }
}
