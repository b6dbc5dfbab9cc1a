package com.signalscope.backend.service.indicator;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Average true range with Wilder smoothing, seeded by the simple mean of the first {@code period} true ranges.
 */
@Service
@RequiredArgsConstructor
public class AtrService {

    private final AnalysisProperties analysisProperties;

    public AtrResult calculate(List<Candle> candles) {
        int period = analysisProperties.getAtr().getPeriod();
        if (candles == null || candles.size() < period + 1) {
            return AtrResult.empty();
        }
        double seed = 0.0;
        for (int i = 1; i <= period; i++) {
            seed += trueRange(candles.get(i - 1), candles.get(i));
        }
        double atr = seed / period;
        for (int i = period + 1; i < candles.size(); i++) {
            atr = ((atr * (period - 1)) + trueRange(candles.get(i - 1), candles.get(i))) / period;
        }
        double lastClose = candles.get(candles.size() - 1).getClose();
        double atrPercent = lastClose <= 0 ? 0 : (atr / lastClose) * 100.0;
        return new AtrResult(atr, atrPercent);
    }

    static double trueRange(Candle prev, Candle curr) {
        return Math.max(curr.range(),
                Math.max(Math.abs(curr.getHigh() - prev.getClose()), Math.abs(curr.getLow() - prev.getClose())));
    }

    public record AtrResult(double atr, double atrPercent) {
        public static AtrResult empty() {
            return new AtrResult(0, 0);
        }
    }
}
