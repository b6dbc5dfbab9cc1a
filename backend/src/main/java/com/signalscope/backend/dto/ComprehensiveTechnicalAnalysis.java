package com.signalscope.backend.dto;

import com.signalscope.backend.model.Timeframe;
import com.signalscope.backend.service.indicator.BollingerBandService.BollingerBands;
import com.signalscope.backend.service.indicator.FibonacciService.FibonacciLevels;

import java.util.List;
import java.util.Map;

/**
 * Multi-timeframe view of one instrument. Bollinger, Fibonacci and candlestick patterns are taken from the
 * daily series.
 */
public record ComprehensiveTechnicalAnalysis(
        Map<Timeframe, TimeframeAnalysis> timeframes,
        AlignmentResult alignment,
        List<String> candlestickPatterns,
        BollingerBands bollinger,
        FibonacciLevels fibonacci,
        PatternConfluence confluence
) {
    public TimeframeAnalysis get(Timeframe timeframe) {
        return timeframes.get(timeframe);
    }

    public TimeframeResult result(Timeframe timeframe) {
        return timeframes.get(timeframe).result();
    }
}
