package com.signalscope.backend.service.pattern;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.dto.PatternMatch;
import com.signalscope.backend.model.Candle;
import com.signalscope.backend.model.PatternKind;
import com.signalscope.backend.model.Reliability;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class CandlestickPatternDetector {

    private final AnalysisProperties analysisProperties;

    /**
     * Scans the most recent candles and returns the latest matches first, capped at the configured maximum.
     * Several patterns may fire on the same candle.
     */
    public List<PatternMatch> detectCandlestickPatterns(List<Candle> candles) {
        List<PatternMatch> all = scan(candles);
        Collections.reverse(all);
        int max = analysisProperties.getCandlestick().getMaxResults();
        return List.copyOf(all.subList(0, Math.min(max, all.size())));
    }

    /**
     * Distinct "Name (polarity)" labels, newest first.
     */
    public List<String> detectPatternNames(List<Candle> candles) {
        List<PatternMatch> all = scan(candles);
        Collections.reverse(all);
        Set<String> names = new LinkedHashSet<>();
        for (PatternMatch match : all) {
            names.add(match.label());
        }
        return names.stream().limit(analysisProperties.getCandlestick().getMaxResults()).toList();
    }

    private List<PatternMatch> scan(List<Candle> candles) {
        AnalysisProperties.Candlestick config = analysisProperties.getCandlestick();
        List<PatternMatch> matches = new ArrayList<>();
        if (candles == null || candles.size() < config.getMinCandles()) {
            return matches;
        }
        int size = candles.size();
        for (int i = Math.max(0, size - config.getWindow()); i < size; i++) {
            Candle current = candles.get(i);
            Candle prev = i > 0 ? candles.get(i - 1) : null;
            Candle prev2 = i > 1 ? candles.get(i - 2) : null;

            detectDoji(current, i, matches);
            detectHammer(current, i, matches);
            detectInvertedHammer(prev, current, i, matches);
            detectEngulfing(prev, current, i, matches);
            detectStar(prev2, prev, current, i, matches);
            detectMarubozu(current, i, matches);
        }
        return matches;
    }

    private void detectDoji(Candle candle, int index, List<PatternMatch> out) {
        double range = candle.range();
        if (range > 0 && candle.body() < range * analysisProperties.getCandlestick().getDojiBodyRatio()) {
            out.add(match(PatternKind.DOJI, index));
        }
    }

    private void detectHammer(Candle candle, int index, List<PatternMatch> out) {
        AnalysisProperties.Candlestick config = analysisProperties.getCandlestick();
        double body = candle.body();
        if (body > 0
                && candle.lowerWick() > body * config.getWickToBody()
                && candle.upperWick() < body * config.getOppositeWickToBody()) {
            out.add(match(PatternKind.HAMMER, index));
        }
    }

    // Same shape for both; a lower close than the prior candle reads as a shooting star.
    private void detectInvertedHammer(Candle prev, Candle candle, int index, List<PatternMatch> out) {
        AnalysisProperties.Candlestick config = analysisProperties.getCandlestick();
        double body = candle.body();
        if (body > 0
                && candle.upperWick() > body * config.getWickToBody()
                && candle.lowerWick() < body * config.getOppositeWickToBody()) {
            boolean afterRise = prev != null && prev.getClose() > candle.getClose();
            out.add(match(afterRise ? PatternKind.SHOOTING_STAR : PatternKind.INVERTED_HAMMER, index));
        }
    }

    private void detectEngulfing(Candle prev, Candle curr, int index, List<PatternMatch> out) {
        if (prev == null || curr.body() == 0) {
            return;
        }
        boolean engulfsBody = curr.body() > prev.body();
        if (curr.isBullish() && !prev.isBullish() && engulfsBody
                && curr.getOpen() < prev.getClose() && curr.getClose() > prev.getOpen()) {
            out.add(match(PatternKind.BULLISH_ENGULFING, index));
        }
        if (!curr.isBullish() && prev.isBullish() && engulfsBody
                && curr.getOpen() > prev.getClose() && curr.getClose() < prev.getOpen()) {
            out.add(match(PatternKind.BEARISH_ENGULFING, index));
        }
    }

    private void detectStar(Candle first, Candle middle, Candle last, int index, List<PatternMatch> out) {
        if (first == null || middle == null) {
            return;
        }
        AnalysisProperties.Candlestick config = analysisProperties.getCandlestick();
        double middleBody = middle.body();
        boolean starShape = first.body() > middleBody * config.getStarOuterToMiddle()
                && last.body() > middleBody * config.getStarLastToMiddle();
        if (!starShape) {
            return;
        }
        double firstMid = (first.getOpen() + first.getClose()) / 2.0;
        if (!first.isBullish() && last.isBullish() && last.getClose() > firstMid) {
            out.add(match(PatternKind.MORNING_STAR, index));
        }
        if (first.isBullish() && !last.isBullish() && last.getClose() < firstMid) {
            out.add(match(PatternKind.EVENING_STAR, index));
        }
    }

    private void detectMarubozu(Candle candle, int index, List<PatternMatch> out) {
        double range = candle.range();
        if (range > 0 && candle.body() > range * analysisProperties.getCandlestick().getMarubozuBodyRatio()) {
            out.add(match(candle.isBullish() ? PatternKind.BULLISH_MARUBOZU : PatternKind.BEARISH_MARUBOZU, index));
        }
    }

    private PatternMatch match(PatternKind kind, int index) {
        String description = kind.displayName() + " with " + kind.reliability().name().toLowerCase() + " reliability";
        return PatternMatch.candle(kind, confidenceFor(kind.reliability()), description, index);
    }

    private int confidenceFor(Reliability reliability) {
        AnalysisProperties.Candlestick config = analysisProperties.getCandlestick();
        return reliability == Reliability.HIGH
                ? config.getHighReliabilityConfidence()
                : config.getMediumReliabilityConfidence();
    }
}
