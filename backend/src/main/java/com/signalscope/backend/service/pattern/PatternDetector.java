package com.signalscope.backend.service.pattern;

import com.signalscope.backend.dto.PatternAnalysis;
import com.signalscope.backend.dto.PatternMatch;
import com.signalscope.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

@Service
@RequiredArgsConstructor
public class PatternDetector {

    private final ChartPatternDetector chartPatternDetector;
    private final TrendClassifier trendClassifier;

    /**
     * Runs every chart rule, ranks the matches by confidence (stable, so detection order breaks ties) and
     * attaches the trend and breakout flags.
     */
    public PatternAnalysis detectPatterns(List<Candle> candles) {
        List<Candle> series = candles == null ? List.of() : candles;
        List<PatternMatch> ranked = chartPatternDetector.rules().stream()
                .map(rule -> rule.detect(series))
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingInt(PatternMatch::confidence).reversed())
                .toList();

        PatternMatch primary = ranked.isEmpty() ? null : ranked.get(0);
        List<PatternMatch> secondary = ranked.isEmpty() ? List.of() : ranked.subList(1, ranked.size());
        return new PatternAnalysis(
                primary,
                secondary,
                trendClassifier.classify(series),
                trendClassifier.isAtBreakout(series),
                trendClassifier.isAtBreakdown(series)
        );
    }
}
