package com.signalscope.backend.service.analysis;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.dto.AlignmentResult;
import com.signalscope.backend.dto.ComprehensiveTechnicalAnalysis;
import com.signalscope.backend.dto.TimeframeAnalysis;
import com.signalscope.backend.dto.TimeframeData;
import com.signalscope.backend.dto.TimeframeResult;
import com.signalscope.backend.exception.AnalysisException;
import com.signalscope.backend.model.Alignment;
import com.signalscope.backend.model.Candle;
import com.signalscope.backend.model.PatternKind;
import com.signalscope.backend.model.Timeframe;
import com.signalscope.backend.model.TrendDirection;
import com.signalscope.backend.service.indicator.IndicatorCalculator;
import com.signalscope.backend.service.pattern.CandlestickPatternDetector;
import com.signalscope.backend.service.pattern.ChartPatternDetector;
import com.signalscope.backend.service.pattern.PatternDetector;
import com.signalscope.backend.service.pattern.TrendClassifier;
import com.signalscope.backend.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MultiTimeframeAnalyzerTest {

    private final AnalysisProperties properties = new AnalysisProperties();
    private final MultiTimeframeAnalyzer analyzer = analyzer(IndicatorCalculator.withDefaults(properties));

    @Test
    void flatSeriesAreNeutralAndConsolidating() {
        TimeframeData data = new TimeframeData(
                TestCandleFactory.flatCandles(40, 100),
                TestCandleFactory.flatCandles(30, 100),
                TestCandleFactory.flatCandles(24, 100)
        );

        ComprehensiveTechnicalAnalysis analysis = analyzer.analyzeMultiTimeframe(data);

        assertThat(analysis.alignment()).isEqualTo(new AlignmentResult(Alignment.NEUTRAL, 50));
        for (Timeframe timeframe : Timeframe.values()) {
            TimeframeAnalysis tf = analysis.get(timeframe);
            assertThat(tf.result().trend()).isEqualTo(TrendDirection.SIDEWAYS);
            assertThat(tf.patterns().trend().consolidating()).isTrue();
            assertThat(tf.degenerate()).isFalse();
        }
    }

    @Test
    void risingSeriesAlignBullish() {
        TimeframeData data = new TimeframeData(
                TestCandleFactory.trendingCandles(60, 100, 1),
                TestCandleFactory.trendingCandles(40, 100, 2),
                TestCandleFactory.trendingCandles(25, 100, 3)
        );

        ComprehensiveTechnicalAnalysis analysis = analyzer.analyzeMultiTimeframe(data);

        assertThat(analysis.alignment()).isEqualTo(new AlignmentResult(Alignment.BULLISH, 100));
        TimeframeResult daily = analysis.result(Timeframe.DAILY);
        assertThat(daily.patternNames()).hasSizeLessThanOrEqualTo(5).contains(PatternKind.ABOVE_MAS);
        assertThat(daily.support()).isLessThan(daily.resistance());
        assertThat(analysis.fibonacci().levels()).hasSize(5);
    }

    @Test
    void shortSeriesYieldDegenerateTimeframe() {
        TimeframeData data = new TimeframeData(
                TestCandleFactory.trendingCandles(40, 100, 1),
                TestCandleFactory.trendingCandles(40, 100, 1),
                TestCandleFactory.trendingCandles(3, 100, 1)
        );

        ComprehensiveTechnicalAnalysis analysis = analyzer.analyzeMultiTimeframe(data);

        TimeframeAnalysis monthly = analysis.get(Timeframe.MONTHLY);
        assertThat(monthly.degenerate()).isTrue();
        assertThat(monthly.result()).isEqualTo(TimeframeResult.degenerate());
        assertThat(monthly.indicators().rsi().value()).isEqualTo(50.0);
        assertThat(analysis.alignment().label()).isEqualTo(Alignment.MIXED);
        assertThat(analysis.alignment().score()).isEqualTo(80);
    }

    @Test
    void missingSeriesAreTreatedAsEmpty() {
        ComprehensiveTechnicalAnalysis analysis = analyzer.analyzeMultiTimeframe(new TimeframeData(null, null, null));

        assertThat(analysis.timeframes().values()).allMatch(TimeframeAnalysis::degenerate);
        assertThat(analysis.candlestickPatterns()).isEmpty();
        assertThat(analysis.alignment().label()).isEqualTo(Alignment.NEUTRAL);
    }

    @Test
    void alignmentScoreStaysInDocumentedSet() {
        Set<Integer> allowed = Set.of(100, 50, 35, 65, 20, 80);
        List<TrendDirection> directions = List.of(TrendDirection.values());
        for (TrendDirection d : directions) {
            for (TrendDirection w : directions) {
                for (TrendDirection m : directions) {
                    AlignmentResult result = analyzer.computeAlignment(List.of(result(d), result(w), result(m)));

                    assertThat(allowed).contains(result.score());
                    assertThat(result.score()).isBetween(20, 100);
                }
            }
        }
    }

    @Test
    void mixedAlignmentMovesFifteenPointsPerVote() {
        AlignmentResult twoUp = analyzer.computeAlignment(List.of(
                result(TrendDirection.UPTREND), result(TrendDirection.UPTREND), result(TrendDirection.SIDEWAYS)));
        AlignmentResult twoDown = analyzer.computeAlignment(List.of(
                result(TrendDirection.DOWNTREND), result(TrendDirection.SIDEWAYS), result(TrendDirection.DOWNTREND)));
        AlignmentResult allDown = analyzer.computeAlignment(List.of(
                result(TrendDirection.DOWNTREND), result(TrendDirection.DOWNTREND), result(TrendDirection.DOWNTREND)));

        assertThat(twoUp).isEqualTo(new AlignmentResult(Alignment.MIXED, 80));
        assertThat(twoDown).isEqualTo(new AlignmentResult(Alignment.MIXED, 20));
        assertThat(allDown).isEqualTo(new AlignmentResult(Alignment.BEARISH, 100));
    }

    @Test
    void failingTimeframeTaskIsWrapped() {
        IndicatorCalculator failing = mock(IndicatorCalculator.class);
        when(failing.computeIndicators(anyList())).thenThrow(new IllegalStateException("boom"));
        MultiTimeframeAnalyzer broken = analyzer(failing);
        List<Candle> candles = new ArrayList<>(TestCandleFactory.trendingCandles(30, 100, 1));

        assertThatThrownBy(() -> broken.analyzeMultiTimeframe(new TimeframeData(candles, candles, candles)))
                .isInstanceOf(AnalysisException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    private MultiTimeframeAnalyzer analyzer(IndicatorCalculator calculator) {
        return new MultiTimeframeAnalyzer(
                properties,
                calculator,
                new PatternDetector(new ChartPatternDetector(properties), new TrendClassifier(properties)),
                new CandlestickPatternDetector(properties),
                new PatternConfluenceAnalyzer(properties),
                Runnable::run
        );
    }

    private static TimeframeResult result(TrendDirection direction) {
        return new TimeframeResult(List.of(), direction, 0, 0, 0);
    }
}
