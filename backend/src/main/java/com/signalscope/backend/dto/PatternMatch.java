package com.signalscope.backend.dto;

import com.signalscope.backend.model.Bias;
import com.signalscope.backend.model.PatternKind;

/**
 * One detected pattern. Chart patterns carry a target or stop; candlestick matches carry the index of the
 * candle they fired on.
 */
public record PatternMatch(
        PatternKind kind,
        Bias polarity,
        int confidence,
        String description,
        Double targetPrice,
        Double stopLoss,
        Integer index
) {
    public static PatternMatch chart(PatternKind kind, int confidence, String description,
                                     Double targetPrice, Double stopLoss) {
        return new PatternMatch(kind, kind.polarity(), confidence, description, targetPrice, stopLoss, null);
    }

    public static PatternMatch candle(PatternKind kind, int confidence, String description, int index) {
        return new PatternMatch(kind, kind.polarity(), confidence, description, null, null, index);
    }

    public String label() {
        return kind.displayName() + " (" + polarity.label() + ")";
    }
}
