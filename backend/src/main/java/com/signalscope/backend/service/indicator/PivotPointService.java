package com.signalscope.backend.service.indicator;

import com.signalscope.backend.model.Candle;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Classic floor-trader pivots from the most recent completed candle.
 */
@Service
public class PivotPointService {

    public PivotLevels calculate(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return PivotLevels.empty();
        }
        Candle last = candles.get(candles.size() - 1);
        double high = last.getHigh();
        double low = last.getLow();
        double pivot = (high + low + last.getClose()) / 3.0;
        double r1 = 2 * pivot - low;
        double r2 = pivot + (high - low);
        double s1 = 2 * pivot - high;
        double s2 = pivot - (high - low);
        return new PivotLevels(pivot, r1, r2, s1, s2);
    }

    public record PivotLevels(double pivot, double r1, double r2, double s1, double s2) {
        public static PivotLevels empty() {
            return new PivotLevels(0, 0, 0, 0, 0);
        }

        public double support() {
            return s1;
        }

        public double resistance() {
            return r1;
        }
    }
}
