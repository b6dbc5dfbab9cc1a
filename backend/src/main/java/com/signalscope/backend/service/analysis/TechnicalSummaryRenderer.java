package com.signalscope.backend.service.analysis;

import com.signalscope.backend.dto.ComprehensiveTechnicalAnalysis;
import com.signalscope.backend.dto.ConfidenceResult;
import com.signalscope.backend.dto.ConflictResult;
import com.signalscope.backend.dto.IndicatorSet;
import com.signalscope.backend.dto.PatternConfluence;
import com.signalscope.backend.dto.RiskMetrics;
import com.signalscope.backend.dto.StockAnalysis;
import com.signalscope.backend.dto.TimeframeResult;
import com.signalscope.backend.model.PatternKind;
import com.signalscope.backend.model.Timeframe;
import com.signalscope.backend.service.indicator.BollingerBandService.BollingerBands;
import com.signalscope.backend.service.indicator.FibonacciService.FibonacciLevel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text rendering of analysis results for report and prompt builders. Output depends only on the input.
 */
@Service
public class TechnicalSummaryRenderer {

    private static final String BULLET = "- ";

    public String toSummaryText(ComprehensiveTechnicalAnalysis analysis) {
        List<String> lines = new ArrayList<>();
        lines.add("MULTI-TIMEFRAME ANALYSIS:");
        for (Timeframe timeframe : Timeframe.values()) {
            TimeframeResult result = analysis.result(timeframe);
            lines.add(BULLET + timeframe.displayName() + " Trend: " + result.trend().label()
                    + " (" + result.strength() + "%)");
        }
        lines.add(BULLET + "Overall Alignment: " + analysis.alignment().label().name().toLowerCase()
                + " (" + analysis.alignment().score() + "%)");
        lines.add("");

        IndicatorSet daily = analysis.get(Timeframe.DAILY).indicators();
        lines.add("INDICATORS (Daily):");
        lines.add(BULLET + "RSI: " + number(daily.rsi().value()) + " (" + daily.rsi().interpretation().name().toLowerCase() + ")");
        lines.add(BULLET + "MACD: " + daily.macd().trend().label() + " (Histogram: " + number(daily.macd().histogram()) + ")");
        lines.add(BULLET + "Volume: " + daily.volume().trend().name().toLowerCase() + " (" + number(daily.volume().ratio()) + "x avg)");
        lines.add(BULLET + "ADX: " + number(daily.adx().adx()) + (daily.adx().trending() ? " (trending)" : " (ranging)"));
        lines.add(BULLET + "ATR: " + number(daily.atr().atr()) + " (" + number(daily.atr().atrPercent()) + "%)");
        lines.add("");

        BollingerBands bands = analysis.bollinger();
        lines.add("BOLLINGER BANDS:");
        lines.add(BULLET + "Upper: " + number(bands.upper()));
        lines.add(BULLET + "Middle: " + number(bands.middle()));
        lines.add(BULLET + "Lower: " + number(bands.lower()));
        lines.add(BULLET + "Position: " + bands.position().name().toLowerCase() + " (%B: " + number(bands.percentB()) + ")");
        lines.add("");

        lines.add("FIBONACCI LEVELS:");
        for (FibonacciLevel level : analysis.fibonacci().levels()) {
            lines.add(BULLET + level.label() + ": " + number(level.price()));
        }
        lines.add("");

        lines.add("CANDLESTICK PATTERNS:");
        if (analysis.candlestickPatterns().isEmpty()) {
            lines.add(BULLET + "No significant patterns");
        } else {
            analysis.candlestickPatterns().forEach(name -> lines.add(BULLET + name));
        }
        lines.add("");

        for (Timeframe timeframe : Timeframe.values()) {
            lines.add("PATTERNS (" + timeframe.displayName() + "):");
            lines.add(renderPatternList(analysis.result(timeframe).patternNames()));
        }
        PatternConfluence confluence = analysis.confluence();
        lines.add(BULLET + "Confluence: " + confluence.agreement().name().toLowerCase()
                + " (" + confluence.score() + "%), " + confluence.recommendation());
        lines.add("");

        TimeframeResult dailyResult = analysis.result(Timeframe.DAILY);
        lines.add("KEY SUPPORT/RESISTANCE:");
        lines.add(BULLET + "Daily Support: " + number(dailyResult.support()));
        lines.add(BULLET + "Daily Resistance: " + number(dailyResult.resistance()));
        return String.join("\n", lines);
    }

    public String toSummaryText(StockAnalysis analysis) {
        ConfidenceResult confidence = analysis.confidence();
        List<String> lines = new ArrayList<>();
        lines.add(analysis.symbol() + " as of " + analysis.asOf());
        lines.add("");
        lines.add(toSummaryText(analysis.technical()));
        lines.add("");
        lines.add("CONFIDENCE:");
        lines.add(BULLET + "Score: " + confidence.score() + " (" + confidence.recommendation() + ", "
                + confidence.direction().bias().label() + " bias, " + confidence.direction().conviction() + "% conviction)");
        confidence.factors().forEach(factor -> lines.add(BULLET + factor));
        lines.add("");
        lines.add("FUNDAMENTALS:");
        lines.add(BULLET + conflictSummary(analysis.conflict()));
        analysis.conflict().details().forEach(detail -> lines.add(BULLET + detail));
        lines.add(BULLET + analysis.conflict().recommendation());
        lines.add("");
        RiskMetrics risk = analysis.riskMetrics();
        lines.add("RISK METRICS:");
        lines.add(BULLET + "Expected Return: " + number(risk.expectedReturn()) + "%");
        lines.add(BULLET + "Risk/Reward: " + number(risk.riskRewardRatio()));
        lines.add(BULLET + "Win Rate: " + number(risk.winRate()) + "%");
        lines.add(BULLET + "Volatility: " + number(risk.volatility()) + "% (annualized)");
        lines.add(BULLET + "Max Drawdown: " + number(risk.maxDrawdown()) + "%");
        lines.add(BULLET + "Sharpe: " + number(risk.sharpeRatio()));
        lines.add("");
        lines.add("FINAL: " + analysis.finalRecommendation() + " (" + analysis.finalScore() + ")");
        return String.join("\n", lines);
    }

    /**
     * One bullet per pattern, in the order given.
     */
    public String renderPatternList(List<PatternKind> patterns) {
        if (patterns.isEmpty()) {
            return BULLET + "None";
        }
        List<String> bullets = new ArrayList<>();
        for (PatternKind kind : patterns) {
            bullets.add(BULLET + kind.displayName());
        }
        return String.join("\n", bullets);
    }

    public String conflictSummary(ConflictResult conflict) {
        if (!conflict.hasConflict()) {
            return "Fundamental-technical alignment: " + conflict.fundamentalVerdict();
        }
        return "Conflict detected: " + conflict.technicalBias().label() + " technical but " + conflict.fundamentalVerdict();
    }

    private static String number(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
