package com.signalscope.backend.service.analysis;

import com.signalscope.backend.dto.RiskMetrics;
import com.signalscope.backend.dto.StockAnalysis;
import com.signalscope.backend.dto.TimeframeData;
import com.signalscope.backend.model.Candle;
import com.signalscope.backend.model.ConflictType;
import com.signalscope.backend.model.FundamentalData;
import com.signalscope.backend.model.Growth;
import com.signalscope.backend.model.NewsSentiment;
import com.signalscope.backend.model.Valuation;
import com.signalscope.backend.util.TestCandleFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;

@SpringBootTest
class StockAnalysisServiceTest {

    @Autowired
    private StockAnalysisService stockAnalysisService;

    @Autowired
    private ConfidenceScorer confidenceScorer;

    @Autowired
    private TechnicalSummaryRenderer renderer;

    @Test
    void conflictAdjustmentFlowsIntoFinalScore() {
        List<Candle> daily = TestCandleFactory.trendingCandles(80, 100, 1);
        FundamentalData fundamentals = FundamentalData.builder()
                .valuation(Valuation.OVERVALUED)
                .peRatio(42.0)
                .growth(Growth.STRONG)
                .build();

        StockAnalysis analysis = stockAnalysisService.analyzeStock("ACME",
                new TimeframeData(daily, TestCandleFactory.trendingCandles(40, 100, 2), TestCandleFactory.trendingCandles(24, 100, 4)),
                NewsSentiment.none(),
                fundamentals);

        assertThat(analysis.asOf()).isEqualTo(daily.get(daily.size() - 1).getDate());
        assertThat(analysis.conflict().technicalBias()).isEqualTo(analysis.confidence().direction().bias());
        assertThat(analysis.conflict().conflictType()).isEqualTo(ConflictType.OVERVALUED_BULLISH);
        assertThat(analysis.finalScore())
                .isEqualTo(Math.max(0, Math.min(100, analysis.confidence().score() + analysis.conflict().confidenceAdjustment())));
        assertThat(analysis.finalRecommendation())
                .isEqualTo(confidenceScorer.recommend(analysis.finalScore(), analysis.confidence().direction().bias()));
        assertThat(analysis.riskMetrics().riskRewardRatio()).isEqualTo(2.0, offset(1e-9));
        assertThat(analysis.riskMetrics().winRate()).isBetween(40.0, 80.0);
        assertThat(renderer.toSummaryText(analysis))
                .contains("ACME as of")
                .contains("RISK METRICS:\n- Expected Return: ")
                .contains("- Risk/Reward: 2.00")
                .contains("FINAL: ");
    }

    @Test
    void emptyInputStillProducesAnalysis() {
        StockAnalysis analysis = stockAnalysisService.analyzeStock("EMPTY",
                new TimeframeData(List.of(), List.of(), List.of()), null, null);

        assertThat(analysis.asOf()).isNull();
        assertThat(analysis.conflict().hasConflict()).isFalse();
        assertThat(analysis.finalScore()).isBetween(0, 100);
        assertThat(analysis.riskMetrics()).isEqualTo(RiskMetrics.neutral());
    }
}
