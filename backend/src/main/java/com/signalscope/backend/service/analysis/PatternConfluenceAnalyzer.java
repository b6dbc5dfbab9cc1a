package com.signalscope.backend.service.analysis;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.dto.PatternAnalysis;
import com.signalscope.backend.dto.PatternConfluence;
import com.signalscope.backend.model.Agreement;
import com.signalscope.backend.model.Bias;
import com.signalscope.backend.model.Timeframe;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@RequiredArgsConstructor
public class PatternConfluenceAnalyzer {

    private final AnalysisProperties analysisProperties;

    public PatternConfluence analyze(Map<Timeframe, PatternAnalysis> patterns) {
        AnalysisProperties.Confluence config = analysisProperties.getConfluence();
        int bullish = 0;
        int bearish = 0;
        for (Timeframe timeframe : Timeframe.values()) {
            Bias vote = vote(patterns.get(timeframe));
            if (vote == Bias.BULLISH) {
                bullish++;
            } else if (vote == Bias.BEARISH) {
                bearish++;
            }
        }
        int total = Timeframe.values().length;
        int dominant = Math.max(bullish, bearish);
        int score = (int) Math.round(dominant * 100.0 / total);

        Agreement agreement;
        int modifier;
        if (dominant == total) {
            agreement = Agreement.STRONG;
            modifier = config.getStrongModifier();
        } else if (dominant == 2 && (bullish == 0 || bearish == 0)) {
            agreement = Agreement.MODERATE;
            modifier = config.getModerateModifier();
        } else if (bullish > 0 && bearish > 0) {
            agreement = Agreement.CONFLICT;
            modifier = config.getConflictModifier();
        } else {
            agreement = Agreement.WEAK;
            modifier = config.getWeakModifier();
        }

        Bias dominantBias = bullish > bearish ? Bias.BULLISH : bearish > bullish ? Bias.BEARISH : Bias.NEUTRAL;
        return new PatternConfluence(agreement, dominantBias, bullish, bearish, score, modifier,
                recommendation(agreement, dominantBias));
    }

    private Bias vote(PatternAnalysis analysis) {
        if (analysis == null || analysis.primary() == null) {
            return Bias.NEUTRAL;
        }
        if (analysis.primary().confidence() < analysisProperties.getConfluence().getMinPatternConfidence()) {
            return Bias.NEUTRAL;
        }
        return analysis.primary().polarity();
    }

    private static String recommendation(Agreement agreement, Bias dominant) {
        return switch (agreement) {
            case STRONG -> "Strong " + dominant.label() + " confluence across all timeframes";
            case MODERATE -> "Moderate " + dominant.label() + " setup, proceed with caution";
            case CONFLICT -> "Conflicting signals, wait for clarity or trade a smaller position";
            case WEAK -> "Weak pattern formation, skip this setup";
        };
    }
}
