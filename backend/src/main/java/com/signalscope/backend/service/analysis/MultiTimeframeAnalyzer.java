package com.signalscope.backend.service.analysis;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.dto.AlignmentResult;
import com.signalscope.backend.dto.ComprehensiveTechnicalAnalysis;
import com.signalscope.backend.dto.IndicatorSet;
import com.signalscope.backend.dto.PatternAnalysis;
import com.signalscope.backend.dto.PatternConfluence;
import com.signalscope.backend.dto.PatternMatch;
import com.signalscope.backend.dto.TimeframeAnalysis;
import com.signalscope.backend.dto.TimeframeData;
import com.signalscope.backend.dto.TimeframeResult;
import com.signalscope.backend.exception.AnalysisException;
import com.signalscope.backend.model.Alignment;
import com.signalscope.backend.model.Bias;
import com.signalscope.backend.model.Candle;
import com.signalscope.backend.model.PatternKind;
import com.signalscope.backend.model.Timeframe;
import com.signalscope.backend.model.TrendDirection;
import com.signalscope.backend.service.indicator.IndicatorCalculator;
import com.signalscope.backend.service.pattern.CandlestickPatternDetector;
import com.signalscope.backend.service.pattern.PatternDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

@Service
@Slf4j
@RequiredArgsConstructor
public class MultiTimeframeAnalyzer {

    private final AnalysisProperties analysisProperties;
    private final IndicatorCalculator indicatorCalculator;
    private final PatternDetector patternDetector;
    private final CandlestickPatternDetector candlestickPatternDetector;
    private final PatternConfluenceAnalyzer patternConfluenceAnalyzer;
    @Qualifier("timeframeExecutor")
    private final Executor timeframeExecutor;

    /**
     * Analyses the three timeframes in parallel and combines them once all have finished.
     *
     * @throws AnalysisException if a timeframe task fails or the calling thread is interrupted
     */
    public ComprehensiveTechnicalAnalysis analyzeMultiTimeframe(TimeframeData data) {
        Map<Timeframe, CompletableFuture<TimeframeAnalysis>> futures = new EnumMap<>(Timeframe.class);
        for (Timeframe timeframe : Timeframe.values()) {
            futures.put(timeframe, CompletableFuture.supplyAsync(
                    () -> analyzeTimeframe(timeframe, data.get(timeframe)), timeframeExecutor));
        }
        awaitAll(futures.values());

        Map<Timeframe, TimeframeAnalysis> timeframes = new EnumMap<>(Timeframe.class);
        Map<Timeframe, PatternAnalysis> patterns = new EnumMap<>(Timeframe.class);
        futures.forEach((timeframe, future) -> {
            TimeframeAnalysis analysis = future.join();
            timeframes.put(timeframe, analysis);
            patterns.put(timeframe, analysis.patterns());
        });

        AlignmentResult alignment = computeAlignment(timeframes.values().stream()
                .map(TimeframeAnalysis::result)
                .toList());
        PatternConfluence confluence = patternConfluenceAnalyzer.analyze(patterns);
        IndicatorSet daily = timeframes.get(Timeframe.DAILY).indicators();

        return new ComprehensiveTechnicalAnalysis(
                Map.copyOf(timeframes),
                alignment,
                candlestickPatternDetector.detectPatternNames(data.daily()),
                daily.bollinger(),
                daily.fibonacci(),
                confluence
        );
    }

    public TimeframeAnalysis analyzeTimeframe(Timeframe timeframe, List<Candle> candles) {
        List<Candle> series = candles == null ? List.of() : candles;
        IndicatorSet indicators = indicatorCalculator.computeIndicators(series);
        if (series.size() < analysisProperties.getMinIndicatorCandles()) {
            log.warn("{} series has {} candles, reporting a neutral timeframe", timeframe.displayName(), series.size());
            return new TimeframeAnalysis(timeframe, series.size(), true, indicators, PatternAnalysis.empty(),
                    TimeframeResult.degenerate());
        }

        PatternAnalysis patterns = patternDetector.detectPatterns(series);
        log.debug("{} indicators: RSI {} ({}), MACD {}, MA {}",
                timeframe.code(),
                String.format(Locale.ROOT, "%.1f", indicators.rsi().value()),
                indicators.rsi().interpretation(),
                indicators.macd().trend(),
                indicators.movingAverages().trend());

        TimeframeResult result = new TimeframeResult(
                patternNames(patterns, indicators.movingAverages().trend()),
                patterns.trend().direction(),
                patterns.trend().strength(),
                indicators.supportResistance().support(),
                indicators.supportResistance().resistance()
        );
        return new TimeframeAnalysis(timeframe, series.size(), false, indicators, patterns, result);
    }

    /**
     * Counts uptrends as bullish and downtrends as bearish. Mixed scores move 15 points per net vote
     * away from 50.
     */
    public AlignmentResult computeAlignment(List<TimeframeResult> results) {
        AnalysisProperties.Alignment config = analysisProperties.getAlignment();
        long bullish = results.stream().filter(r -> r.trend() == TrendDirection.UPTREND).count();
        long bearish = results.stream().filter(r -> r.trend() == TrendDirection.DOWNTREND).count();

        if (bullish == results.size() && bullish > 0) {
            return new AlignmentResult(Alignment.BULLISH, config.getAlignedScore());
        }
        if (bearish == results.size() && bearish > 0) {
            return new AlignmentResult(Alignment.BEARISH, config.getAlignedScore());
        }
        if (bullish == 0 && bearish == 0) {
            return new AlignmentResult(Alignment.NEUTRAL, config.getNeutralScore());
        }
        int score = config.getNeutralScore() + config.getMixedStep() * (int) (bullish - bearish);
        return new AlignmentResult(Alignment.MIXED, score);
    }

    private List<PatternKind> patternNames(PatternAnalysis patterns, Bias maTrend) {
        List<PatternKind> names = new ArrayList<>();
        if (patterns.primary() != null) {
            names.add(patterns.primary().kind());
        }
        patterns.secondary().stream().map(PatternMatch::kind).forEach(names::add);
        if (maTrend == Bias.BULLISH) {
            names.add(PatternKind.ABOVE_MAS);
        } else if (maTrend == Bias.BEARISH) {
            names.add(PatternKind.BELOW_MAS);
        }
        int max = analysisProperties.getAlignment().getMaxPatternNames();
        return List.copyOf(names.subList(0, Math.min(max, names.size())));
    }

    private void awaitAll(Collection<CompletableFuture<TimeframeAnalysis>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException("Timeframe analysis interrupted", e);
        } catch (ExecutionException e) {
            throw new AnalysisException("Timeframe analysis failed", e.getCause());
        }
    }
}
