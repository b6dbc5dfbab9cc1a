package com.signalscope.backend.service.indicator;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.model.BollingerPosition;
import com.signalscope.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class BollingerBandService {

    private final AnalysisProperties analysisProperties;

    public BollingerBands calculate(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return BollingerBands.flat(0.0);
        }
        AnalysisProperties.Bollinger config = analysisProperties.getBollinger();
        int period = config.getPeriod();
        double close = candles.get(candles.size() - 1).getClose();
        if (candles.size() < period) {
            return BollingerBands.flat(close);
        }

        List<Candle> window = candles.subList(candles.size() - period, candles.size());
        double mean = window.stream().mapToDouble(Candle::getClose).average().orElse(0.0);
        double variance = window.stream()
                .mapToDouble(candle -> {
                    double diff = candle.getClose() - mean;
                    return diff * diff;
                })
                .average()
                .orElse(0.0);
        double standardDeviation = Math.sqrt(variance);
        double upper = mean + (standardDeviation * config.getDeviation());
        double lower = mean - (standardDeviation * config.getDeviation());
        double bandwidth = mean == 0 ? 0 : (upper - lower) / mean * 100.0;
        double percentB = upper == lower ? 0.5 : (close - lower) / (upper - lower);
        return new BollingerBands(upper, mean, lower, bandwidth, positionOf(close, upper, mean, lower), percentB);
    }

    private BollingerPosition positionOf(double close, double upper, double middle, double lower) {
        if (close > upper) {
            return BollingerPosition.ABOVE_UPPER;
        }
        if (close > middle + (upper - middle) / 2) {
            return BollingerPosition.UPPER_HALF;
        }
        if (close < lower) {
            return BollingerPosition.BELOW_LOWER;
        }
        if (close < middle - (middle - lower) / 2) {
            return BollingerPosition.LOWER_HALF;
        }
        return BollingerPosition.MIDDLE;
    }

    /**
     * @param bandwidth band width as a percentage of the middle band
     * @param percentB  %B, 0 at the lower band and 1 at the upper band; may leave [0,1]
     */
    public record BollingerBands(double upper, double middle, double lower, double bandwidth,
                                 BollingerPosition position, double percentB) {
        public static BollingerBands flat(double price) {
            return new BollingerBands(price, price, price, 0, BollingerPosition.MIDDLE, 0.5);
        }
    }
}
