package com.signalscope.backend.service.pattern;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.dto.PatternMatch;
import com.signalscope.backend.model.Candle;
import com.signalscope.backend.model.PatternKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Flag, triangle and bounce/rejection detectors. Each inspects the tail of the series independently and returns
 * {@code null} when it does not match.
 */
@Service
@RequiredArgsConstructor
public class ChartPatternDetector {

    private final AnalysisProperties analysisProperties;

    public List<ChartPatternRule> rules() {
        return List.of(
                this::detectBullishFlag,
                this::detectAscendingTriangle,
                this::detectSupportBounce,
                this::detectBearishFlag,
                this::detectDescendingTriangle,
                this::detectResistanceRejection
        );
    }

    public PatternMatch detectBullishFlag(List<Candle> candles) {
        AnalysisProperties.ChartPattern config = analysisProperties.getChartPattern();
        FlagShape shape = flagShape(candles);
        if (shape == null) {
            return null;
        }
        if (shape.poleChange() > config.getMinPolePercent()
                && shape.flagChange() > config.getBullFlagMinPercent()
                && shape.flagChange() < config.getBullFlagMaxPercent()) {
            double target = shape.flagEnd() + (shape.poleEnd() - shape.poleStart());
            String description = String.format(Locale.ROOT, "Flag after %.1f%% rally", shape.poleChange());
            return PatternMatch.chart(PatternKind.BULLISH_FLAG, flagConfidence(shape.poleChange()), description,
                    target, null);
        }
        return null;
    }

    public PatternMatch detectBearishFlag(List<Candle> candles) {
        AnalysisProperties.ChartPattern config = analysisProperties.getChartPattern();
        FlagShape shape = flagShape(candles);
        if (shape == null) {
            return null;
        }
        if (shape.poleChange() < -config.getMinPolePercent()
                && shape.flagChange() > config.getBearFlagMinPercent()
                && shape.flagChange() < config.getBearFlagMaxPercent()) {
            double target = shape.flagEnd() - Math.abs(shape.poleEnd() - shape.poleStart());
            String description = String.format(Locale.ROOT, "Flag after %.1f%% decline", Math.abs(shape.poleChange()));
            return PatternMatch.chart(PatternKind.BEARISH_FLAG, flagConfidence(shape.poleChange()), description,
                    target, null);
        }
        return null;
    }

    public PatternMatch detectAscendingTriangle(List<Candle> candles) {
        AnalysisProperties.ChartPattern config = analysisProperties.getChartPattern();
        List<Candle> recent = window(candles, config.getMinCandles());
        if (recent == null) {
            return null;
        }
        double maxHigh = recent.stream().mapToDouble(Candle::getHigh).max().orElse(0.0);
        double minLow = recent.stream().mapToDouble(Candle::getLow).min().orElse(0.0);
        double touchLevel = maxHigh * (1 - config.getTriangleTouchTolerance());
        long touches = recent.stream().filter(c -> c.getHigh() >= touchLevel).count();

        int half = recent.size() / 2;
        double firstLows = averageLow(recent.subList(0, half));
        double lastLows = averageLow(recent.subList(half, recent.size()));

        if (touches >= config.getTriangleMinTouches() && lastLows > firstLows * (1 + config.getTriangleSlopeThreshold())) {
            return PatternMatch.chart(PatternKind.ASCENDING_TRIANGLE, config.getTriangleConfidence(),
                    "Higher lows with flat resistance", maxHigh + (maxHigh - minLow), null);
        }
        return null;
    }

    public PatternMatch detectDescendingTriangle(List<Candle> candles) {
        AnalysisProperties.ChartPattern config = analysisProperties.getChartPattern();
        List<Candle> recent = window(candles, config.getMinCandles());
        if (recent == null) {
            return null;
        }
        double maxHigh = recent.stream().mapToDouble(Candle::getHigh).max().orElse(0.0);
        double minLow = recent.stream().mapToDouble(Candle::getLow).min().orElse(0.0);
        double touchLevel = minLow * (1 + config.getTriangleTouchTolerance());
        long touches = recent.stream().filter(c -> c.getLow() <= touchLevel).count();

        int half = recent.size() / 2;
        double firstHighs = averageHigh(recent.subList(0, half));
        double lastHighs = averageHigh(recent.subList(half, recent.size()));

        if (touches >= config.getTriangleMinTouches() && lastHighs < firstHighs * (1 - config.getTriangleSlopeThreshold())) {
            return PatternMatch.chart(PatternKind.DESCENDING_TRIANGLE, config.getTriangleConfidence(),
                    "Lower highs with flat support", minLow - (maxHigh - minLow), null);
        }
        return null;
    }

    public PatternMatch detectSupportBounce(List<Candle> candles) {
        AnalysisProperties.ChartPattern config = analysisProperties.getChartPattern();
        if (candles == null || candles.size() < config.getBounceMinCandles()) {
            return null;
        }
        Candle last = candles.get(candles.size() - 1);
        Candle prev = candles.get(candles.size() - 2);
        double support = tail(candles, config.getBounceLookback()).stream()
                .mapToDouble(Candle::getLow).min().orElse(0.0);

        if (prev.getLow() <= support * (1 + config.getBounceTolerance())
                && last.getClose() > prev.getClose()
                && last.isBullish()) {
            String description = String.format(Locale.ROOT, "Bounce from support at %.0f", support);
            return PatternMatch.chart(PatternKind.SUPPORT_BOUNCE, config.getBounceConfidence(), description,
                    null, support * (1 - config.getBounceTolerance()));
        }
        return null;
    }

    public PatternMatch detectResistanceRejection(List<Candle> candles) {
        AnalysisProperties.ChartPattern config = analysisProperties.getChartPattern();
        if (candles == null || candles.size() < config.getBounceMinCandles()) {
            return null;
        }
        Candle last = candles.get(candles.size() - 1);
        Candle prev = candles.get(candles.size() - 2);
        double resistance = tail(candles, config.getBounceLookback()).stream()
                .mapToDouble(Candle::getHigh).max().orElse(0.0);

        if (prev.getHigh() >= resistance * (1 - config.getBounceTolerance())
                && last.getClose() < prev.getClose()
                && last.getClose() < last.getOpen()) {
            String description = String.format(Locale.ROOT, "Rejection from resistance at %.0f", resistance);
            return PatternMatch.chart(PatternKind.RESISTANCE_REJECTION, config.getBounceConfidence(), description,
                    null, resistance * (1 + config.getBounceTolerance()));
        }
        return null;
    }

    private FlagShape flagShape(List<Candle> candles) {
        AnalysisProperties.ChartPattern config = analysisProperties.getChartPattern();
        List<Candle> recent = window(candles, config.getMinCandles());
        if (recent == null) {
            return null;
        }
        int pole = config.getPoleLength();
        double poleStart = recent.get(0).getClose();
        double poleEnd = recent.get(pole - 1).getClose();
        double flagStart = recent.get(pole).getClose();
        double flagEnd = recent.get(recent.size() - 1).getClose();
        if (poleStart == 0 || flagStart == 0) {
            return null;
        }
        double poleChange = (poleEnd - poleStart) / poleStart * 100;
        double flagChange = (flagEnd - flagStart) / flagStart * 100;
        return new FlagShape(poleStart, poleEnd, flagEnd, poleChange, flagChange);
    }

    private int flagConfidence(double poleChange) {
        AnalysisProperties.ChartPattern config = analysisProperties.getChartPattern();
        double raw = config.getFlagBaseConfidence() + Math.abs(poleChange) * config.getFlagPoleMultiplier();
        return (int) Math.round(Math.min(raw, config.getFlagMaxConfidence()));
    }

    private List<Candle> window(List<Candle> candles, int minCandles) {
        if (candles == null || candles.size() < minCandles) {
            return null;
        }
        return tail(candles, analysisProperties.getChartPattern().getWindow());
    }

    private static List<Candle> tail(List<Candle> candles, int count) {
        return candles.subList(Math.max(0, candles.size() - count), candles.size());
    }

    private static double averageLow(List<Candle> candles) {
        return candles.stream().mapToDouble(Candle::getLow).average().orElse(0.0);
    }

    private static double averageHigh(List<Candle> candles) {
        return candles.stream().mapToDouble(Candle::getHigh).average().orElse(0.0);
    }

    private record FlagShape(double poleStart, double poleEnd, double flagEnd, double poleChange, double flagChange) {}
}
