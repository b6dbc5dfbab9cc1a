package com.signalscope.backend.service.indicator;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.model.Bias;
import com.signalscope.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Service
@RequiredArgsConstructor
public class MacdService {

    private final AnalysisProperties analysisProperties;

    public MacdResult calculate(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return MacdResult.empty();
        }
        AnalysisProperties.Macd config = analysisProperties.getMacd();
        int fast = config.getFastPeriod();
        int slow = config.getSlowPeriod();
        int signal = config.getSignalPeriod();

        List<Double> closes = candles.stream().map(Candle::getClose).toList();
        List<Double> fastSeries = calculateEmaSeries(closes, fast);
        List<Double> slowSeries = calculateEmaSeries(closes, slow);

        List<Double> macdSeries = new ArrayList<>();
        for (int i = 0; i < closes.size(); i++) {
            Double fastVal = fastSeries.get(i);
            Double slowVal = slowSeries.get(i);
            if (fastVal != null && slowVal != null) {
                macdSeries.add(fastVal - slowVal);
            }
        }

        if (macdSeries.size() < signal) {
            return MacdResult.empty();
        }

        List<Double> signalSeries = calculateEmaSeries(macdSeries, signal);
        List<Double> histogramSeries = new ArrayList<>();
        for (int i = 0; i < macdSeries.size(); i++) {
            Double signalVal = signalSeries.get(i);
            if (signalVal != null) {
                histogramSeries.add(macdSeries.get(i) - signalVal);
            }
        }

        double macdLine = macdSeries.get(macdSeries.size() - 1);
        double signalLine = signalSeries.get(signalSeries.size() - 1);
        double histogram = macdLine - signalLine;

        Bias trend = Bias.NEUTRAL;
        if (histogram > 0) {
            trend = Bias.BULLISH;
        } else if (histogram < 0) {
            trend = Bias.BEARISH;
        }
        Bias divergence = detectDivergence(closes, histogramSeries, config);
        return new MacdResult(macdLine, signalLine, histogram, trend, divergence);
    }

    /**
     * A new high in price that the histogram fails to confirm is bearish; a new low it fails to confirm is bullish.
     */
    private Bias detectDivergence(List<Double> closes, List<Double> histogramSeries, AnalysisProperties.Macd config) {
        int lookback = config.getDivergenceLookback();
        if (lookback < 2 || closes.size() < lookback || histogramSeries.size() < lookback) {
            return Bias.NEUTRAL;
        }
        List<Double> recentCloses = closes.subList(closes.size() - lookback, closes.size());
        List<Double> recentHist = histogramSeries.subList(histogramSeries.size() - lookback, histogramSeries.size());
        List<Double> priorCloses = recentCloses.subList(0, lookback - 1);
        List<Double> priorHist = recentHist.subList(0, lookback - 1);

        double currentPrice = recentCloses.get(lookback - 1);
        double currentHist = recentHist.get(lookback - 1);
        double factor = config.getDivergenceFactor();

        if (currentPrice > Collections.max(priorCloses)) {
            double maxHist = Collections.max(priorHist);
            if (maxHist > 0 && currentHist < maxHist * factor) {
                return Bias.BEARISH;
            }
        } else if (currentPrice < Collections.min(priorCloses)) {
            double minHist = Collections.min(priorHist);
            if (minHist < 0 && currentHist > minHist * factor) {
                return Bias.BULLISH;
            }
        }
        return Bias.NEUTRAL;
    }

    private List<Double> calculateEmaSeries(List<Double> values, int period) {
        List<Double> emaSeries = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            emaSeries.add(null);
        }
        if (values.size() < period) {
            return emaSeries;
        }
        double sma = values.subList(0, period).stream().mapToDouble(d -> d).average().orElse(0.0);
        emaSeries.set(period - 1, sma);
        double k = 2.0 / (period + 1);
        double ema = sma;
        for (int i = period; i < values.size(); i++) {
            ema = (values.get(i) * k) + (ema * (1 - k));
            emaSeries.set(i, ema);
        }
        return emaSeries;
    }

    /**
     * @param divergence {@link Bias#NEUTRAL} when no divergence is present
     */
    public record MacdResult(double macdLine, double signalLine, double histogram, Bias trend, Bias divergence) {
        public static MacdResult empty() {
            return new MacdResult(0, 0, 0, Bias.NEUTRAL, Bias.NEUTRAL);
        }
    }
}
