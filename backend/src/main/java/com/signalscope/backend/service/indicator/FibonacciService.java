package com.signalscope.backend.service.indicator;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.model.Candle;
import com.signalscope.backend.model.SwingDirection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Retracement levels between the highest and lowest close of the lookback window. When the high came last the
 * swing is up and levels are measured down from the high; otherwise they are measured up from the low.
 */
@Service
@RequiredArgsConstructor
public class FibonacciService {

    private final AnalysisProperties analysisProperties;

    public FibonacciLevels calculate(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return FibonacciLevels.empty(0.0);
        }
        double lastClose = candles.get(candles.size() - 1).getClose();
        if (candles.size() < analysisProperties.getMinIndicatorCandles()) {
            return FibonacciLevels.empty(lastClose);
        }

        AnalysisProperties.Fibonacci config = analysisProperties.getFibonacci();
        int window = Math.min(config.getLookback(), candles.size());
        List<Candle> recent = candles.subList(candles.size() - window, candles.size());

        int highIndex = 0;
        int lowIndex = 0;
        for (int i = 1; i < recent.size(); i++) {
            double close = recent.get(i).getClose();
            if (close >= recent.get(highIndex).getClose()) {
                highIndex = i;
            }
            if (close <= recent.get(lowIndex).getClose()) {
                lowIndex = i;
            }
        }
        double high = recent.get(highIndex).getClose();
        double low = recent.get(lowIndex).getClose();
        double diff = high - low;
        SwingDirection direction = highIndex >= lowIndex ? SwingDirection.UP : SwingDirection.DOWN;

        List<FibonacciLevel> levels = config.getRatios().stream()
                .map(ratio -> new FibonacciLevel(ratio,
                        direction == SwingDirection.UP ? high - diff * ratio : low + diff * ratio))
                .toList();
        return new FibonacciLevels(high, low, direction, levels);
    }

    public record FibonacciLevel(double ratio, double price) {
        public String label() {
            return String.format(Locale.ROOT, "%.1f%%", ratio * 100.0);
        }
    }

    public record FibonacciLevels(double high, double low, SwingDirection direction, List<FibonacciLevel> levels) {
        public static FibonacciLevels empty(double price) {
            return new FibonacciLevels(price, price, SwingDirection.UP, List.of());
        }
    }
}
