package com.signalscope.backend.service.analysis;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.dto.ConflictResult;
import com.signalscope.backend.model.Bias;
import com.signalscope.backend.model.ConflictType;
import com.signalscope.backend.model.FundamentalData;
import com.signalscope.backend.model.Growth;
import com.signalscope.backend.model.Valuation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class ConflictDetector {

    private final AnalysisProperties analysisProperties;

    /**
     * Checks the technical bias against valuation and growth. Rules within a bias are applied in order and a
     * later rule may overwrite the adjustment of an earlier one: an undervalued bullish setup always ends at
     * the undervalued boost even when weak growth was flagged first.
     */
    public ConflictResult detectConflict(Bias technicalBias, FundamentalData fundamentals) {
        AnalysisProperties.Conflict config = analysisProperties.getConflict();
        Bias bias = technicalBias == null ? Bias.NEUTRAL : technicalBias;
        FundamentalData data = fundamentals == null ? FundamentalData.unknown() : fundamentals;
        Valuation valuation = data.getValuation();
        List<String> details = new ArrayList<>();
        ConflictType conflictType = ConflictType.NONE;
        int adjustment = 0;

        if (bias == Bias.BULLISH) {
            Double pe = data.getPeRatio();
            if (valuation == Valuation.OVERVALUED && pe != null && pe > config.getOvervaluedPeRatio()) {
                conflictType = ConflictType.OVERVALUED_BULLISH;
                adjustment = config.getOvervaluedBullishAdjustment();
                details.add(String.format(Locale.ROOT,
                        "Technically bullish but fundamentally overvalued (P/E %.1f)", pe));
            }
            if (data.getGrowth() == Growth.WEAK) {
                conflictType = ConflictType.WEAK_GROWTH_BULLISH;
                adjustment = Math.min(adjustment, config.getWeakGrowthBullishAdjustment());
                details.add("Bullish technical setup but weak earnings growth");
            }
            if (valuation == Valuation.UNDERVALUED) {
                adjustment = config.getUndervaluedBullishAdjustment();
                details.add("Fundamental support: undervalued with " + data.getGrowth().name().toLowerCase() + " growth");
            }
        } else if (bias == Bias.BEARISH) {
            if (valuation == Valuation.UNDERVALUED && data.getGrowth() == Growth.STRONG) {
                conflictType = ConflictType.UNDERVALUED_BEARISH;
                adjustment = config.getUndervaluedBearishAdjustment();
                details.add("Bearish technical but fundamentally undervalued, potential reversal");
            }
            if (valuation == Valuation.OVERVALUED) {
                adjustment = config.getOvervaluedBearishAdjustment();
                details.add("Fundamental weakness confirms the bearish setup");
            }
        }

        int max = config.getMaxAdjustment();
        adjustment = Math.max(-max, Math.min(max, adjustment));
        return new ConflictResult(
                conflictType != ConflictType.NONE,
                bias,
                data.verdict(),
                conflictType,
                adjustment,
                recommendation(conflictType, bias),
                List.copyOf(details)
        );
    }

    private static String recommendation(ConflictType conflictType, Bias bias) {
        return switch (conflictType) {
            case OVERVALUED_BULLISH ->
                    "Proceed with caution: technically strong but overvalued. Consider a smaller position or wait for a pullback.";
            case UNDERVALUED_BEARISH ->
                    "Bearish setup on an attractive valuation: support may appear soon. Wait for a reversal signal.";
            case WEAK_GROWTH_BULLISH -> "Technical strength is not backed by fundamentals: be ready to exit quickly.";
            case NONE -> bias == Bias.NEUTRAL
                    ? "No strong technical or fundamental bias: skip"
                    : "Fundamental and technical analysis aligned: higher confidence.";
        };
    }
}
