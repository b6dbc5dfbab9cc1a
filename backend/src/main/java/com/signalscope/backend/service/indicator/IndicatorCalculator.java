package com.signalscope.backend.service.indicator;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.dto.IndicatorSet;
import com.signalscope.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class IndicatorCalculator {

    private final AnalysisProperties analysisProperties;
    private final RsiService rsiService;
    private final MovingAverageService movingAverageService;
    private final PivotPointService pivotPointService;
    private final VolumeService volumeService;
    private final MacdService macdService;
    private final AtrService atrService;
    private final AdxService adxService;
    private final BollingerBandService bollingerBandService;
    private final FibonacciService fibonacciService;

    /**
     * Computes every indicator for an ascending candle series. Series shorter than the configured minimum get
     * {@link IndicatorSet#degenerate}, so callers check the length before trusting the values.
     */
    public IndicatorSet computeIndicators(List<Candle> candles) {
        if (candles == null || candles.size() < analysisProperties.getMinIndicatorCandles()) {
            double lastClose = candles == null || candles.isEmpty() ? 0.0 : candles.get(candles.size() - 1).getClose();
            return IndicatorSet.degenerate(analysisProperties.getRsi().getNeutralValue(), lastClose);
        }
        return new IndicatorSet(
                rsiService.calculate(candles),
                movingAverageService.calculate(candles),
                pivotPointService.calculate(candles),
                volumeService.calculate(candles),
                macdService.calculate(candles),
                atrService.calculate(candles),
                adxService.calculate(candles),
                bollingerBandService.calculate(candles),
                fibonacciService.calculate(candles)
        );
    }

    public static IndicatorCalculator withDefaults(AnalysisProperties properties) {
        return new IndicatorCalculator(
                properties,
                new RsiService(properties),
                new MovingAverageService(properties),
                new PivotPointService(),
                new VolumeService(properties),
                new MacdService(properties),
                new AtrService(properties),
                new AdxService(properties),
                new BollingerBandService(properties),
                new FibonacciService(properties)
        );
    }
}
