package com.signalscope.backend.service.indicator;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.model.Candle;
import com.signalscope.backend.model.VolumeTrend;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class VolumeService {

    private final AnalysisProperties analysisProperties;

    public VolumeAnalysis calculate(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return VolumeAnalysis.empty();
        }
        AnalysisProperties.Volume config = analysisProperties.getVolume();
        int window = Math.min(config.getAveragePeriod(), candles.size());
        long current = candles.get(candles.size() - 1).getVolume();
        double average = candles.subList(candles.size() - window, candles.size()).stream()
                .mapToLong(Candle::getVolume)
                .average()
                .orElse(0.0);
        if (average <= 0) {
            return new VolumeAnalysis(current, 0.0, 1.0, VolumeTrend.NORMAL);
        }
        double ratio = current / average;
        VolumeTrend trend = VolumeTrend.NORMAL;
        if (ratio > config.getHighRatio()) {
            trend = VolumeTrend.HIGH;
        } else if (ratio < config.getLowRatio()) {
            trend = VolumeTrend.LOW;
        }
        return new VolumeAnalysis(current, average, ratio, trend);
    }

    public record VolumeAnalysis(long current, double average, double ratio, VolumeTrend trend) {
        public static VolumeAnalysis empty() {
            return new VolumeAnalysis(0, 0.0, 1.0, VolumeTrend.NORMAL);
        }
    }
}
