package com.signalscope.backend.service.analysis;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.dto.AlignmentResult;
import com.signalscope.backend.dto.ConfidenceInput;
import com.signalscope.backend.dto.ConfidenceResult;
import com.signalscope.backend.dto.IndicatorSet;
import com.signalscope.backend.dto.PatternAnalysis;
import com.signalscope.backend.dto.PatternMatch;
import com.signalscope.backend.dto.TrendResult;
import com.signalscope.backend.model.Alignment;
import com.signalscope.backend.model.Bias;
import com.signalscope.backend.model.FundamentalData;
import com.signalscope.backend.model.Growth;
import com.signalscope.backend.model.ImpactLevel;
import com.signalscope.backend.model.NewsSentiment;
import com.signalscope.backend.model.PatternKind;
import com.signalscope.backend.model.Recommendation;
import com.signalscope.backend.model.RsiZone;
import com.signalscope.backend.model.SectorComparison;
import com.signalscope.backend.model.Sentiment;
import com.signalscope.backend.model.TrendDirection;
import com.signalscope.backend.model.Valuation;
import com.signalscope.backend.model.VolumeTrend;
import com.signalscope.backend.service.indicator.AdxService.AdxResult;
import com.signalscope.backend.service.indicator.AtrService.AtrResult;
import com.signalscope.backend.service.indicator.BollingerBandService.BollingerBands;
import com.signalscope.backend.service.indicator.FibonacciService.FibonacciLevels;
import com.signalscope.backend.service.indicator.MacdService.MacdResult;
import com.signalscope.backend.service.indicator.MovingAverageService.MovingAverages;
import com.signalscope.backend.service.indicator.PivotPointService.PivotLevels;
import com.signalscope.backend.service.indicator.RsiService.RsiResult;
import com.signalscope.backend.service.indicator.VolumeService.VolumeAnalysis;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer(new AnalysisProperties());

    @Test
    void neutralInputsScoreMidRangeHold() {
        ConfidenceResult result = scorer.scoreConfidence(new ConfidenceInput(
                PatternAnalysis.empty(),
                IndicatorSet.degenerate(50, 100),
                new AlignmentResult(Alignment.NEUTRAL, 50),
                NewsSentiment.none(),
                FundamentalData.unknown()
        ));

        assertThat(result.breakdown().patternStrength()).isEqualTo(50);
        assertThat(result.breakdown().newsSentiment()).isEqualTo(50);
        assertThat(result.breakdown().volumeConfirmation()).isEqualTo(45);
        assertThat(result.score()).isEqualTo(49);
        assertThat(result.recommendation()).isEqualTo(Recommendation.HOLD);
        assertThat(result.direction().bias()).isEqualTo(Bias.NEUTRAL);
        assertThat(result.direction().bullishSignals()).isEqualTo(1);
        assertThat(result.direction().conviction()).isEqualTo(8);
    }

    @Test
    void missingIndicatorsScoreLikeNeutralIndicators() {
        AlignmentResult alignment = new AlignmentResult(Alignment.NEUTRAL, 50);

        ConfidenceResult missing = scorer.scoreConfidence(new ConfidenceInput(
                PatternAnalysis.empty(), null, alignment, NewsSentiment.none(), FundamentalData.unknown()));
        ConfidenceResult neutral = scorer.scoreConfidence(new ConfidenceInput(
                PatternAnalysis.empty(), IndicatorSet.degenerate(50, 100), alignment, NewsSentiment.none(),
                FundamentalData.unknown()));

        assertThat(missing).isEqualTo(neutral);
        assertThat(missing.breakdown().volumeConfirmation()).isEqualTo(45);
    }

    @Test
    void alignedBullishSetupIsBuy() {
        PatternMatch flag = PatternMatch.chart(PatternKind.BULLISH_FLAG, 90, "flag", 120.0, null);
        ConfidenceResult result = scorer.scoreConfidence(new ConfidenceInput(
                new PatternAnalysis(flag, List.of(), new TrendResult(TrendDirection.UPTREND, 40, false), false, false),
                indicators(60, Bias.BULLISH, Bias.BULLISH, 2.5),
                new AlignmentResult(Alignment.BULLISH, 100),
                NewsSentiment.builder().sentiment(Sentiment.POSITIVE).score(80).impactLevel(ImpactLevel.HIGH).itemCount(3).build(),
                FundamentalData.builder()
                        .valuation(Valuation.UNDERVALUED)
                        .growth(Growth.STRONG)
                        .sectorComparison(SectorComparison.OUTPERFORMING)
                        .build()
        ));

        assertThat(result.breakdown().patternStrength()).isEqualTo(90);
        assertThat(result.breakdown().newsSentiment()).isEqualTo(100);
        assertThat(result.breakdown().technicalAlignment()).isEqualTo(100);
        assertThat(result.breakdown().volumeConfirmation()).isEqualTo(95);
        assertThat(result.breakdown().fundamentalStrength()).isEqualTo(100);
        assertThat(result.score()).isEqualTo(97);
        assertThat(result.direction().bias()).isEqualTo(Bias.BULLISH);
        assertThat(result.direction().bullishSignals()).isEqualTo(5);
        assertThat(result.direction().conviction()).isEqualTo(42);
        assertThat(result.recommendation()).isEqualTo(Recommendation.BUY);
        assertThat(result.factors()).first().isEqualTo("Primary pattern: Bullish Flag (90%)");
    }

    @Test
    void alignedBearishSetupIsSell() {
        PatternMatch flag = PatternMatch.chart(PatternKind.BEARISH_FLAG, 85, "flag", 80.0, null);
        ConfidenceResult result = scorer.scoreConfidence(new ConfidenceInput(
                new PatternAnalysis(flag, List.of(), TrendResult.sideways(), false, true),
                indicators(25, Bias.BEARISH, Bias.BEARISH, 1.8),
                new AlignmentResult(Alignment.BEARISH, 100),
                NewsSentiment.builder().sentiment(Sentiment.NEUTRAL).score(70).itemCount(2).build(),
                FundamentalData.builder().valuation(Valuation.FAIR).growth(Growth.MODERATE).build()
        ));

        assertThat(result.direction().bias()).isEqualTo(Bias.BEARISH);
        assertThat(result.direction().bearishSignals()).isEqualTo(5);
        assertThat(result.score()).isGreaterThanOrEqualTo(70);
        assertThat(result.recommendation()).isEqualTo(Recommendation.SELL);
    }

    @Test
    void newsImpactShiftsScoreBySentiment() {
        ConfidenceResult result = scorer.scoreConfidence(new ConfidenceInput(
                PatternAnalysis.empty(),
                IndicatorSet.degenerate(50, 100),
                new AlignmentResult(Alignment.NEUTRAL, 50),
                NewsSentiment.builder().sentiment(Sentiment.NEGATIVE).score(40).impactLevel(ImpactLevel.MEDIUM).itemCount(1).build(),
                FundamentalData.unknown()
        ));

        assertThat(result.breakdown().newsSentiment()).isEqualTo(30);
    }

    @Test
    void volumeLadderMapsRatios() {
        assertThat(volumeScore(2.1)).isEqualTo(95);
        assertThat(volumeScore(1.5)).isEqualTo(80);
        assertThat(volumeScore(1.2)).isEqualTo(65);
        assertThat(volumeScore(0.8)).isEqualTo(45);
        assertThat(volumeScore(0.6)).isEqualTo(30);
        assertThat(volumeScore(0.5)).isEqualTo(20);
    }

    @Test
    void scoreIsAlwaysClamped() {
        int[] confidences = {0, 100, 250};
        int[] newsScores = {-500, 0, 100, 500};
        int[] alignmentScores = {-300, 0, 100, 300};
        double[] ratios = {0.0, 1.0, 50.0};
        for (int confidence : confidences) {
            for (int news : newsScores) {
                for (int alignment : alignmentScores) {
                    for (double ratio : ratios) {
                        PatternMatch match = PatternMatch.chart(PatternKind.BULLISH_FLAG, confidence, "x", null, null);
                        ConfidenceResult result = scorer.scoreConfidence(new ConfidenceInput(
                                new PatternAnalysis(match, List.of(), TrendResult.sideways(), true, true),
                                indicators(50, Bias.BULLISH, Bias.BEARISH, ratio),
                                new AlignmentResult(Alignment.MIXED, alignment),
                                NewsSentiment.builder().sentiment(Sentiment.POSITIVE).score(news)
                                        .impactLevel(ImpactLevel.HIGH).itemCount(1).build(),
                                FundamentalData.builder().valuation(Valuation.OVERVALUED).growth(Growth.WEAK)
                                        .sectorComparison(SectorComparison.UNDERPERFORMING).build()
                        ));

                        assertThat(result.score()).isBetween(0, 100);
                        assertThat(result.breakdown().fundamentalStrength()).isEqualTo(3);
                    }
                }
            }
        }
    }

    @Test
    void recommendationThresholds() {
        assertThat(scorer.recommend(70, Bias.BULLISH)).isEqualTo(Recommendation.BUY);
        assertThat(scorer.recommend(70, Bias.BEARISH)).isEqualTo(Recommendation.SELL);
        assertThat(scorer.recommend(85, Bias.NEUTRAL)).isEqualTo(Recommendation.HOLD);
        assertThat(scorer.recommend(40, Bias.BULLISH)).isEqualTo(Recommendation.HOLD);
        assertThat(scorer.recommend(39, Bias.BULLISH)).isEqualTo(Recommendation.WAIT);
    }

    @Test
    void zeroWeightsFallBackToNeutral() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.getScoring().setPatternWeight(0);
        properties.getScoring().setNewsWeight(0);
        properties.getScoring().setTechnicalWeight(0);
        properties.getScoring().setVolumeWeight(0);
        properties.getScoring().setFundamentalWeight(0);

        ConfidenceResult result = new ConfidenceScorer(properties).scoreConfidence(new ConfidenceInput(
                PatternAnalysis.empty(),
                IndicatorSet.degenerate(50, 100),
                new AlignmentResult(Alignment.BULLISH, 100),
                NewsSentiment.none(),
                FundamentalData.unknown()
        ));

        assertThat(result.score()).isEqualTo(50);
    }

    private int volumeScore(double ratio) {
        return scorer.scoreConfidence(new ConfidenceInput(
                PatternAnalysis.empty(),
                indicators(50, Bias.NEUTRAL, Bias.NEUTRAL, ratio),
                new AlignmentResult(Alignment.NEUTRAL, 50),
                NewsSentiment.none(),
                FundamentalData.unknown()
        )).breakdown().volumeConfirmation();
    }

    private static IndicatorSet indicators(double rsi, Bias maTrend, Bias macdTrend, double volumeRatio) {
        RsiZone zone = rsi <= 30 ? RsiZone.OVERSOLD : rsi >= 70 ? RsiZone.OVERBOUGHT : RsiZone.NEUTRAL;
        return new IndicatorSet(
                new RsiResult(rsi, zone),
                new MovingAverages(100, 100, 100, 100, 100, maTrend),
                PivotLevels.empty(),
                new VolumeAnalysis(1000, 1000, volumeRatio, VolumeTrend.NORMAL),
                new MacdResult(0, 0, 0, macdTrend, Bias.NEUTRAL),
                AtrResult.empty(),
                AdxResult.empty(),
                BollingerBands.flat(100),
                FibonacciLevels.empty(100)
        );
    }
}
