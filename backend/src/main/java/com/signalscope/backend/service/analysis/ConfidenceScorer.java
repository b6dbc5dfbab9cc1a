package com.signalscope.backend.service.analysis;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.dto.AlignmentResult;
import com.signalscope.backend.dto.ConfidenceBreakdown;
import com.signalscope.backend.dto.ConfidenceInput;
import com.signalscope.backend.dto.ConfidenceResult;
import com.signalscope.backend.dto.DirectionResult;
import com.signalscope.backend.dto.IndicatorSet;
import com.signalscope.backend.dto.PatternAnalysis;
import com.signalscope.backend.dto.PatternMatch;
import com.signalscope.backend.model.Alignment;
import com.signalscope.backend.model.Bias;
import com.signalscope.backend.model.FundamentalData;
import com.signalscope.backend.model.Growth;
import com.signalscope.backend.model.ImpactLevel;
import com.signalscope.backend.model.NewsSentiment;
import com.signalscope.backend.model.Recommendation;
import com.signalscope.backend.model.SectorComparison;
import com.signalscope.backend.model.Sentiment;
import com.signalscope.backend.model.Valuation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class ConfidenceScorer {

    private final AnalysisProperties analysisProperties;

    public ConfidenceResult scoreConfidence(ConfidenceInput input) {
        AnalysisProperties.Scoring weights = analysisProperties.getScoring();
        PatternAnalysis patterns = input.patterns() == null ? PatternAnalysis.empty() : input.patterns();
        NewsSentiment news = input.news() == null ? NewsSentiment.none() : input.news();
        FundamentalData fundamentals = input.fundamentals() == null ? FundamentalData.unknown() : input.fundamentals();
        IndicatorSet indicators = input.indicators() == null
                ? IndicatorSet.degenerate(analysisProperties.getRsi().getNeutralValue(), 0.0)
                : input.indicators();
        List<String> factors = new ArrayList<>();

        int patternScore = scorePattern(patterns.primary(), factors);
        int newsScore = scoreNews(news, factors);
        int alignmentScore = scoreAlignment(input.alignment(), factors);
        int volumeScore = scoreVolume(indicators.volume().ratio(), factors);
        int fundamentalScore = scoreFundamentals(fundamentals, factors);

        ConfidenceBreakdown breakdown = new ConfidenceBreakdown(
                patternScore, newsScore, alignmentScore, volumeScore, fundamentalScore);

        double weightSum = weights.getPatternWeight()
                + weights.getNewsWeight()
                + weights.getTechnicalWeight()
                + weights.getVolumeWeight()
                + weights.getFundamentalWeight();
        double raw = patternScore * weights.getPatternWeight()
                + newsScore * weights.getNewsWeight()
                + alignmentScore * weights.getTechnicalWeight()
                + volumeScore * weights.getVolumeWeight()
                + fundamentalScore * weights.getFundamentalWeight();
        int score = weightSum == 0 ? weights.getNeutralSubScore() : clamp((int) Math.round(raw / weightSum));

        DirectionResult direction = direction(patterns, indicators, input.alignment());
        return new ConfidenceResult(score, breakdown, List.copyOf(factors),
                recommend(score, direction.bias()), direction);
    }

    /**
     * Maps a score and bias to an action. A strong score without a directional bias stays HOLD.
     */
    public Recommendation recommend(int score, Bias bias) {
        AnalysisProperties.Scoring config = analysisProperties.getScoring();
        if (score >= config.getActionThreshold() && bias == Bias.BULLISH) {
            return Recommendation.BUY;
        }
        if (score >= config.getActionThreshold() && bias == Bias.BEARISH) {
            return Recommendation.SELL;
        }
        if (score >= config.getHoldThreshold()) {
            return Recommendation.HOLD;
        }
        return Recommendation.WAIT;
    }

    /**
     * Counts agreeing signals on each side. A side wins with at least two signals and a strict majority.
     */
    public DirectionResult direction(PatternAnalysis patterns, IndicatorSet indicators, AlignmentResult alignment) {
        AnalysisProperties.Scoring config = analysisProperties.getScoring();
        double rsi = indicators.rsi().value();
        Bias primary = patterns.primary() == null ? Bias.NEUTRAL : patterns.primary().polarity();
        Alignment label = alignment == null ? Alignment.NEUTRAL : alignment.label();

        boolean[] bullishChecks = {
                indicators.movingAverages().trend() == Bias.BULLISH,
                indicators.macd().trend() == Bias.BULLISH,
                rsi > config.getRsiHealthyMin() && rsi < analysisProperties.getRsi().getOverbought(),
                primary == Bias.BULLISH,
                patterns.atBreakout(),
                label == Alignment.BULLISH
        };
        boolean[] bearishChecks = {
                indicators.movingAverages().trend() == Bias.BEARISH,
                indicators.macd().trend() == Bias.BEARISH,
                rsi >= analysisProperties.getRsi().getOverbought(),
                primary == Bias.BEARISH,
                patterns.atBreakdown(),
                label == Alignment.BEARISH
        };
        int bullish = count(bullishChecks);
        int bearish = count(bearishChecks);
        int total = bullishChecks.length + bearishChecks.length;

        Bias bias = Bias.NEUTRAL;
        if (bullish > bearish && bullish >= config.getMinDirectionalSignals()) {
            bias = Bias.BULLISH;
        } else if (bearish > bullish && bearish >= config.getMinDirectionalSignals()) {
            bias = Bias.BEARISH;
        }
        int conviction = (int) Math.round(Math.max(bullish, bearish) * 100.0 / total);
        return new DirectionResult(bias, bullish, bearish, conviction);
    }

    private int scorePattern(PatternMatch primary, List<String> factors) {
        if (primary == null) {
            return analysisProperties.getScoring().getDefaultPatternConfidence();
        }
        factors.add("Primary pattern: " + primary.kind().displayName() + " (" + primary.confidence() + "%)");
        return clamp(primary.confidence());
    }

    private int scoreNews(NewsSentiment news, List<String> factors) {
        AnalysisProperties.Scoring config = analysisProperties.getScoring();
        if (news.getItemCount() == 0) {
            return config.getNeutralSubScore();
        }
        int modifier = 0;
        if (news.getImpactLevel() == ImpactLevel.HIGH) {
            modifier = config.getHighImpactNewsModifier();
        } else if (news.getImpactLevel() == ImpactLevel.MEDIUM) {
            modifier = config.getMediumImpactNewsModifier();
        }
        int score = news.getScore();
        if (news.getSentiment() == Sentiment.POSITIVE) {
            score += modifier;
        } else if (news.getSentiment() == Sentiment.NEGATIVE) {
            score -= modifier;
        }
        score = clamp(score);
        factors.add("News sentiment " + news.getSentiment().name().toLowerCase()
                + " with " + news.getImpactLevel().name().toLowerCase() + " impact (" + score + ")");
        return score;
    }

    private int scoreAlignment(AlignmentResult alignment, List<String> factors) {
        if (alignment == null) {
            return analysisProperties.getScoring().getNeutralSubScore();
        }
        if (alignment.score() != analysisProperties.getScoring().getNeutralSubScore()) {
            factors.add("Timeframe alignment " + alignment.label().name().toLowerCase() + " (" + alignment.score() + ")");
        }
        return clamp(alignment.score());
    }

    private int scoreVolume(double ratio, List<String> factors) {
        String formatted = String.format(Locale.ROOT, "%.1fx", ratio);
        int score;
        if (ratio > 2.0) {
            score = 95;
            factors.add("Exceptional volume (" + formatted + " average)");
        } else if (ratio >= analysisProperties.getVolume().getHighRatio()) {
            score = 80;
            factors.add("High volume confirmation (" + formatted + " average)");
        } else if (ratio > 1.0) {
            score = 65;
            factors.add("Above average volume (" + formatted + ")");
        } else if (ratio > 0.7) {
            score = 45;
            factors.add("Below average volume (" + formatted + ")");
        } else if (ratio > analysisProperties.getVolume().getLowRatio()) {
            score = 30;
            factors.add("Low volume (" + formatted + ")");
        } else {
            score = 20;
            factors.add("Very low volume (" + formatted + ")");
        }
        return score;
    }

    private int scoreFundamentals(FundamentalData fundamentals, List<String> factors) {
        int score = analysisProperties.getScoring().getNeutralSubScore();
        Valuation valuation = fundamentals.getValuation();
        if (valuation == Valuation.UNDERVALUED) {
            score += 25;
            factors.add("Undervalued by fundamentals");
        } else if (valuation == Valuation.OVERVALUED) {
            score -= 20;
            factors.add("Overvalued, premium pricing risk");
        } else if (valuation == Valuation.FAIR) {
            score += 5;
        }

        Growth growth = fundamentals.getGrowth();
        if (growth == Growth.STRONG) {
            score += 20;
            factors.add("Strong growth metrics");
        } else if (growth == Growth.WEAK) {
            score -= 15;
            factors.add("Weak growth");
        } else if (growth == Growth.MODERATE) {
            score += 8;
        }

        SectorComparison sector = fundamentals.getSectorComparison();
        if (sector == SectorComparison.OUTPERFORMING) {
            score += 12;
            factors.add("Outperforming sector");
        } else if (sector == SectorComparison.UNDERPERFORMING) {
            score -= 12;
            factors.add("Underperforming sector");
        }
        return clamp(score);
    }

    private static int count(boolean[] checks) {
        int count = 0;
        for (boolean check : checks) {
            if (check) {
                count++;
            }
        }
        return count;
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
