package com.signalscope.backend.service.analysis;

import com.signalscope.backend.dto.ComprehensiveTechnicalAnalysis;
import com.signalscope.backend.dto.ConfidenceInput;
import com.signalscope.backend.dto.ConfidenceResult;
import com.signalscope.backend.dto.ConflictResult;
import com.signalscope.backend.dto.RiskMetrics;
import com.signalscope.backend.dto.StockAnalysis;
import com.signalscope.backend.dto.TimeframeAnalysis;
import com.signalscope.backend.dto.TimeframeData;
import com.signalscope.backend.model.Candle;
import com.signalscope.backend.model.FundamentalData;
import com.signalscope.backend.model.NewsSentiment;
import com.signalscope.backend.model.Recommendation;
import com.signalscope.backend.model.Timeframe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class StockAnalysisService {

    private final MultiTimeframeAnalyzer multiTimeframeAnalyzer;
    private final ConfidenceScorer confidenceScorer;
    private final ConflictDetector conflictDetector;
    private final RiskMetricsService riskMetricsService;

    /**
     * Runs the full pipeline for one instrument. The conflict adjustment is applied to the confidence score and
     * the recommendation is derived again from the adjusted score.
     */
    public StockAnalysis analyzeStock(String symbol, TimeframeData timeframes, NewsSentiment news,
                                      FundamentalData fundamentals) {
        ComprehensiveTechnicalAnalysis technical = multiTimeframeAnalyzer.analyzeMultiTimeframe(timeframes);
        TimeframeAnalysis daily = technical.get(Timeframe.DAILY);

        ConfidenceResult confidence = confidenceScorer.scoreConfidence(new ConfidenceInput(
                daily.patterns(),
                daily.indicators(),
                technical.alignment(),
                news,
                fundamentals
        ));
        ConflictResult conflict = conflictDetector.detectConflict(confidence.direction().bias(), fundamentals);

        int finalScore = Math.max(0, Math.min(100, confidence.score() + conflict.confidenceAdjustment()));
        Recommendation finalRecommendation = confidenceScorer.recommend(finalScore, confidence.direction().bias());
        RiskMetrics risk = riskMetricsService.calculateRiskMetrics(timeframes.daily(), daily.indicators(), finalScore);

        log.info("Analysed {}: alignment {} ({}), score {} -> {}, {} | conflict {}",
                symbol,
                technical.alignment().label(),
                technical.alignment().score(),
                confidence.score(),
                finalScore,
                finalRecommendation,
                conflict.conflictType());
        return new StockAnalysis(symbol, asOf(timeframes.daily()), technical, confidence, conflict, risk,
                finalScore, finalRecommendation);
    }

    private static LocalDate asOf(List<Candle> daily) {
        return daily.isEmpty() ? null : daily.get(daily.size() - 1).getDate();
    }
}
