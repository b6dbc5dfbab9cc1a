package com.signalscope.backend.dto;

import com.signalscope.backend.service.indicator.AdxService.AdxResult;
import com.signalscope.backend.service.indicator.AtrService.AtrResult;
import com.signalscope.backend.service.indicator.BollingerBandService.BollingerBands;
import com.signalscope.backend.service.indicator.FibonacciService.FibonacciLevels;
import com.signalscope.backend.service.indicator.MacdService.MacdResult;
import com.signalscope.backend.service.indicator.MovingAverageService.MovingAverages;
import com.signalscope.backend.service.indicator.PivotPointService.PivotLevels;
import com.signalscope.backend.service.indicator.RsiService.RsiResult;
import com.signalscope.backend.service.indicator.VolumeService.VolumeAnalysis;

public record IndicatorSet(
        RsiResult rsi,
        MovingAverages movingAverages,
        PivotLevels supportResistance,
        VolumeAnalysis volume,
        MacdResult macd,
        AtrResult atr,
        AdxResult adx,
        BollingerBands bollinger,
        FibonacciLevels fibonacci
) {
    /**
     * Neutral bundle for series too short to analyse.
     */
    public static IndicatorSet degenerate(double neutralRsi, double lastClose) {
        return new IndicatorSet(
                RsiResult.neutral(neutralRsi),
                MovingAverages.empty(),
                PivotLevels.empty(),
                VolumeAnalysis.empty(),
                MacdResult.empty(),
                AtrResult.empty(),
                AdxResult.empty(),
                BollingerBands.flat(lastClose),
                FibonacciLevels.empty(lastClose)
        );
    }
}
