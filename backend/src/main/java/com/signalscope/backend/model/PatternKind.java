package com.signalscope.backend.model;

/**
 * Every pattern the engine can report. Detectors, the timeframe aggregator, the scorer and the
 * summary renderer exchange these constants instead of free-form names.
 */
public enum PatternKind {
    DOJI("Doji", PatternFamily.CANDLESTICK, Bias.NEUTRAL, Reliability.MEDIUM),
    HAMMER("Hammer", PatternFamily.CANDLESTICK, Bias.BULLISH, Reliability.HIGH),
    INVERTED_HAMMER("Inverted Hammer", PatternFamily.CANDLESTICK, Bias.BULLISH, Reliability.MEDIUM),
    SHOOTING_STAR("Shooting Star", PatternFamily.CANDLESTICK, Bias.BEARISH, Reliability.MEDIUM),
    BULLISH_ENGULFING("Bullish Engulfing", PatternFamily.CANDLESTICK, Bias.BULLISH, Reliability.HIGH),
    BEARISH_ENGULFING("Bearish Engulfing", PatternFamily.CANDLESTICK, Bias.BEARISH, Reliability.HIGH),
    MORNING_STAR("Morning Star", PatternFamily.CANDLESTICK, Bias.BULLISH, Reliability.HIGH),
    EVENING_STAR("Evening Star", PatternFamily.CANDLESTICK, Bias.BEARISH, Reliability.HIGH),
    BULLISH_MARUBOZU("Bullish Marubozu", PatternFamily.CANDLESTICK, Bias.BULLISH, Reliability.MEDIUM),
    BEARISH_MARUBOZU("Bearish Marubozu", PatternFamily.CANDLESTICK, Bias.BEARISH, Reliability.MEDIUM),

    BULLISH_FLAG("Bullish Flag", PatternFamily.CHART, Bias.BULLISH, Reliability.HIGH),
    BEARISH_FLAG("Bearish Flag", PatternFamily.CHART, Bias.BEARISH, Reliability.HIGH),
    ASCENDING_TRIANGLE("Ascending Triangle", PatternFamily.CHART, Bias.BULLISH, Reliability.HIGH),
    DESCENDING_TRIANGLE("Descending Triangle", PatternFamily.CHART, Bias.BEARISH, Reliability.HIGH),
    SUPPORT_BOUNCE("Support Bounce", PatternFamily.CHART, Bias.BULLISH, Reliability.MEDIUM),
    RESISTANCE_REJECTION("Resistance Rejection", PatternFamily.CHART, Bias.BEARISH, Reliability.MEDIUM),

    ABOVE_MAS("Above MAs", PatternFamily.MOVING_AVERAGE, Bias.BULLISH, Reliability.LOW),
    BELOW_MAS("Below MAs", PatternFamily.MOVING_AVERAGE, Bias.BEARISH, Reliability.LOW);

    private final String displayName;
    private final PatternFamily family;
    private final Bias polarity;
    private final Reliability reliability;

    PatternKind(String displayName, PatternFamily family, Bias polarity, Reliability reliability) {
        this.displayName = displayName;
        this.family = family;
        this.polarity = polarity;
        this.reliability = reliability;
    }

    public String displayName() {
        return displayName;
    }

    public PatternFamily family() {
        return family;
    }

    public Bias polarity() {
        return polarity;
    }

    public Reliability reliability() {
        return reliability;
    }
}
