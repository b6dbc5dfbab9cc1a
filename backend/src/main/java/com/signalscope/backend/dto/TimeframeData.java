package com.signalscope.backend.dto;

import com.signalscope.backend.model.Candle;
import com.signalscope.backend.model.Timeframe;

import java.util.List;

/**
 * Candle series for the three analysed timeframes, each ascending by date. Missing series are empty.
 */
public record TimeframeData(List<Candle> daily, List<Candle> weekly, List<Candle> monthly) {

    public TimeframeData {
        daily = daily == null ? List.of() : List.copyOf(daily);
        weekly = weekly == null ? List.of() : List.copyOf(weekly);
        monthly = monthly == null ? List.of() : List.copyOf(monthly);
    }

    public List<Candle> get(Timeframe timeframe) {
        return switch (timeframe) {
            case DAILY -> daily;
            case WEEKLY -> weekly;
            case MONTHLY -> monthly;
        };
    }
}
