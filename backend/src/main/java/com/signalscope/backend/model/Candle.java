package com.signalscope.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
@AllArgsConstructor
public class Candle {
    double open;
    double high;
    double low;
    double close;
    long volume;
    LocalDate date;

    public double body() {
        return Math.abs(close - open);
    }

    public double range() {
        return high - low;
    }

    public double upperWick() {
        return high - Math.max(open, close);
    }

    public double lowerWick() {
        return Math.min(open, close) - low;
    }

    public boolean isBullish() {
        return close > open;
    }
}
