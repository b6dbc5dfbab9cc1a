package com.signalscope.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Every threshold used by the signal engine. Defaults reproduce the documented behavior;
 * override under {@code analysis.*} in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "analysis")
@Data
public class AnalysisProperties {

    private int minIndicatorCandles = 5;
    private Rsi rsi = new Rsi();
    private MovingAverage movingAverage = new MovingAverage();
    private Macd macd = new Macd();
    private Bollinger bollinger = new Bollinger();
    private Fibonacci fibonacci = new Fibonacci();
    private Atr atr = new Atr();
    private Adx adx = new Adx();
    private Volume volume = new Volume();
    private Candlestick candlestick = new Candlestick();
    private ChartPattern chartPattern = new ChartPattern();
    private Trend trend = new Trend();
    private Alignment alignment = new Alignment();
    private Confluence confluence = new Confluence();
    private Scoring scoring = new Scoring();
    private Conflict conflict = new Conflict();
    private Risk risk = new Risk();

    @Data
    public static class Rsi {
        private int period = 14;
        private double oversold = 30.0;
        private double overbought = 70.0;
        private double neutralValue = 50.0;
    }

    @Data
    public static class MovingAverage {
        private int smaShort = 20;
        private int smaMedium = 50;
        private int smaLong = 200;
        private int emaFast = 9;
        private int emaSlow = 21;
    }

    @Data
    public static class Macd {
        private int fastPeriod = 12;
        private int slowPeriod = 26;
        private int signalPeriod = 9;
        private int divergenceLookback = 20;
        private double divergenceFactor = 0.8;
    }

    @Data
    public static class Bollinger {
        private int period = 20;
        private double deviation = 2.0;
    }

    @Data
    public static class Fibonacci {
        private int lookback = 60;
        private List<Double> ratios = List.of(0.236, 0.382, 0.5, 0.618, 0.786);
    }

    @Data
    public static class Atr {
        private int period = 14;
    }

    @Data
    public static class Adx {
        private int period = 14;
        private double trendThreshold = 25.0;
    }

    @Data
    public static class Volume {
        private int averagePeriod = 20;
        private double highRatio = 1.5;
        private double lowRatio = 0.5;
    }

    @Data
    public static class Candlestick {
        private int minCandles = 3;
        private int window = 5;
        private int maxResults = 5;
        private double dojiBodyRatio = 0.1;
        private double wickToBody = 2.0;
        private double oppositeWickToBody = 0.5;
        private double starOuterToMiddle = 3.0;
        private double starLastToMiddle = 2.0;
        private double marubozuBodyRatio = 0.9;
        private int highReliabilityConfidence = 75;
        private int mediumReliabilityConfidence = 60;
    }

    @Data
    public static class ChartPattern {
        private int window = 15;
        private int poleLength = 7;
        private int minCandles = 15;
        private int bounceMinCandles = 10;
        private int bounceLookback = 20;
        private double minPolePercent = 3.0;
        private double bullFlagMinPercent = -2.0;
        private double bullFlagMaxPercent = 1.0;
        private double bearFlagMinPercent = -1.0;
        private double bearFlagMaxPercent = 2.0;
        private double flagBaseConfidence = 75.0;
        private double flagPoleMultiplier = 2.0;
        private double flagMaxConfidence = 95.0;
        private double triangleTouchTolerance = 0.02;
        private int triangleMinTouches = 3;
        private double triangleSlopeThreshold = 0.01;
        private int triangleConfidence = 75;
        private double bounceTolerance = 0.01;
        private int bounceConfidence = 65;
    }

    @Data
    public static class Trend {
        private int minCandles = 10;
        private int lookback = 20;
        private double slopeThresholdPercent = 0.1;
        private double strengthMultiplier = 10.0;
        private double consolidationBandPercent = 2.0;
        private int breakoutLookback = 20;
        private double breakoutFactor = 0.99;
        private double breakdownFactor = 1.01;
    }

    @Data
    public static class Alignment {
        private int alignedScore = 100;
        private int neutralScore = 50;
        private int mixedStep = 15;
        private int maxPatternNames = 5;
    }

    @Data
    public static class Confluence {
        private int minPatternConfidence = 60;
        private int strongModifier = 20;
        private int moderateModifier = 10;
        private int weakModifier = -10;
        private int conflictModifier = -25;
    }

    @Data
    public static class Scoring {
        private double patternWeight = 25.0;
        private double newsWeight = 20.0;
        private double technicalWeight = 25.0;
        private double volumeWeight = 15.0;
        private double fundamentalWeight = 15.0;
        private int defaultPatternConfidence = 50;
        private int neutralSubScore = 50;
        private int actionThreshold = 70;
        private int holdThreshold = 40;
        private int minDirectionalSignals = 2;
        private double rsiHealthyMin = 40.0;
        private int highImpactNewsModifier = 20;
        private int mediumImpactNewsModifier = 10;
    }

    @Data
    public static class Conflict {
        private double overvaluedPeRatio = 30.0;
        private int overvaluedBullishAdjustment = -15;
        private int weakGrowthBullishAdjustment = -10;
        private int undervaluedBullishAdjustment = 15;
        private int undervaluedBearishAdjustment = -10;
        private int overvaluedBearishAdjustment = 10;
        private int maxAdjustment = 30;
    }

    @Data
    public static class Risk {
        private int minCandles = 20;
        private int tradingDaysPerYear = 252;
        private double riskFreeRatePercent = 7.0;
        private double winRateBase = 35.0;
        private double winRatePerConfidencePoint = 0.5;
        private double minWinRate = 40.0;
        private double maxWinRate = 80.0;
        private double targetAtrMultiple = 2.0;
        private double stopAtrMultiple = 1.0;
    }
}
