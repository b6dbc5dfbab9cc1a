package com.signalscope.backend.service.indicator;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.model.Bias;
import com.signalscope.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class MovingAverageService {

    private final AnalysisProperties analysisProperties;

    public MovingAverages calculate(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return MovingAverages.empty();
        }
        AnalysisProperties.MovingAverage config = analysisProperties.getMovingAverage();
        List<Double> closes = candles.stream().map(Candle::getClose).toList();
        double price = closes.get(closes.size() - 1);

        double ema9 = ema(closes, config.getEmaFast());
        double ema21 = ema(closes, config.getEmaSlow());

        Bias trend = Bias.NEUTRAL;
        if (price > ema9 && price > ema21) {
            trend = Bias.BULLISH;
        } else if (price < ema9 && price < ema21) {
            trend = Bias.BEARISH;
        }

        return new MovingAverages(
                sma(closes, config.getSmaShort()),
                sma(closes, config.getSmaMedium()),
                sma(closes, config.getSmaLong()),
                ema9,
                ema21,
                trend
        );
    }

    /**
     * Simple average of the last {@code period} values; falls back to the latest value when the series is shorter.
     */
    public double sma(List<Double> values, int period) {
        if (values.isEmpty()) {
            return 0.0;
        }
        if (values.size() < period) {
            return values.get(values.size() - 1);
        }
        return values.subList(values.size() - period, values.size()).stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }

    /**
     * EMA seeded with the SMA of the first {@code period} values. Shorter series return their plain average.
     */
    public double ema(List<Double> values, int period) {
        if (values.isEmpty()) {
            return 0.0;
        }
        if (values.size() < period) {
            return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        }
        double k = 2.0 / (period + 1);
        double ema = values.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        for (int i = period; i < values.size(); i++) {
            ema = (values.get(i) * k) + (ema * (1 - k));
        }
        return ema;
    }

    public record MovingAverages(double sma20, double sma50, double sma200, double ema9, double ema21, Bias trend) {
        public static MovingAverages empty() {
            return new MovingAverages(0, 0, 0, 0, 0, Bias.NEUTRAL);
        }
    }
}
