package com.signalscope.backend.service.pattern;

import com.signalscope.backend.dto.PatternMatch;
import com.signalscope.backend.model.Candle;

import java.util.List;

/**
 * A single chart-pattern check. Returns {@code null} when the pattern is absent or the series is too short.
 */
@FunctionalInterface
public interface ChartPatternRule {

    PatternMatch detect(List<Candle> candles);
}
