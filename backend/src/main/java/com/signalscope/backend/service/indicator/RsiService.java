package com.signalscope.backend.service.indicator;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.model.Candle;
import com.signalscope.backend.model.RsiZone;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class RsiService {

    private final AnalysisProperties analysisProperties;

    public RsiResult calculate(List<Candle> candles) {
        AnalysisProperties.Rsi config = analysisProperties.getRsi();
        int period = config.getPeriod();
        if (candles == null || candles.size() < period + 1) {
            return RsiResult.neutral(config.getNeutralValue());
        }

        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = candles.get(i).getClose() - candles.get(i - 1).getClose();
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss += Math.abs(change);
            }
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < candles.size(); i++) {
            double change = candles.get(i).getClose() - candles.get(i - 1).getClose();
            double gain = Math.max(change, 0.0);
            double loss = Math.max(-change, 0.0);
            avgGain = ((avgGain * (period - 1)) + gain) / period;
            avgLoss = ((avgLoss * (period - 1)) + loss) / period;
        }

        // flat series: no gains and no losses
        if (avgGain == 0 && avgLoss == 0) {
            return RsiResult.neutral(config.getNeutralValue());
        }
        if (avgLoss == 0) {
            return new RsiResult(100.0, RsiZone.OVERBOUGHT);
        }
        double rs = avgGain / avgLoss;
        double rsi = 100.0 - (100.0 / (1.0 + rs));
        return new RsiResult(rsi, zoneOf(rsi, config));
    }

    private RsiZone zoneOf(double rsi, AnalysisProperties.Rsi config) {
        if (rsi <= config.getOversold()) {
            return RsiZone.OVERSOLD;
        }
        if (rsi >= config.getOverbought()) {
            return RsiZone.OVERBOUGHT;
        }
        return RsiZone.NEUTRAL;
    }

    public record RsiResult(double value, RsiZone interpretation) {
        public static RsiResult neutral(double value) {
            return new RsiResult(value, RsiZone.NEUTRAL);
        }
    }
}
