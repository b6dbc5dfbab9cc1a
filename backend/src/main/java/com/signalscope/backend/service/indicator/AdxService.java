package com.signalscope.backend.service.indicator;

import com.signalscope.backend.config.AnalysisProperties;
import com.signalscope.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class AdxService {

    private final AnalysisProperties analysisProperties;

    public AdxResult calculate(List<Candle> candles) {
        AnalysisProperties.Adx config = analysisProperties.getAdx();
        int period = config.getPeriod();
        if (candles == null || candles.size() < period + 1) {
            return AdxResult.empty();
        }

        int moves = candles.size() - 1;
        double[] tr = new double[moves];
        double[] dmPlus = new double[moves];
        double[] dmMinus = new double[moves];
        for (int i = 1; i < candles.size(); i++) {
            Candle curr = candles.get(i);
            Candle prev = candles.get(i - 1);
            double upMove = curr.getHigh() - prev.getHigh();
            double downMove = prev.getLow() - curr.getLow();
            tr[i - 1] = AtrService.trueRange(prev, curr);
            dmPlus[i - 1] = (upMove > downMove && upMove > 0) ? upMove : 0.0;
            dmMinus[i - 1] = (downMove > upMove && downMove > 0) ? downMove : 0.0;
        }

        double smoothTR = 0.0;
        double smoothPlus = 0.0;
        double smoothMinus = 0.0;
        for (int i = 0; i < period; i++) {
            smoothTR += tr[i];
            smoothPlus += dmPlus[i];
            smoothMinus += dmMinus[i];
        }

        List<Double> dxValues = new ArrayList<>();
        double plusDI = 0.0;
        double minusDI = 0.0;
        for (int i = period - 1; i < moves; i++) {
            if (i > period - 1) {
                smoothTR = smoothTR - (smoothTR / period) + tr[i];
                smoothPlus = smoothPlus - (smoothPlus / period) + dmPlus[i];
                smoothMinus = smoothMinus - (smoothMinus / period) + dmMinus[i];
            }
            if (smoothTR == 0) {
                continue;
            }
            plusDI = 100.0 * (smoothPlus / smoothTR);
            minusDI = 100.0 * (smoothMinus / smoothTR);
            double diSum = plusDI + minusDI;
            dxValues.add(diSum == 0 ? 0.0 : (Math.abs(plusDI - minusDI) / diSum) * 100.0);
        }

        if (dxValues.size() < period) {
            return new AdxResult(0, plusDI, minusDI, false);
        }
        double adx = dxValues.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        for (int i = period; i < dxValues.size(); i++) {
            adx = ((adx * (period - 1)) + dxValues.get(i)) / period;
        }
        return new AdxResult(adx, plusDI, minusDI, adx >= config.getTrendThreshold());
    }

    public record AdxResult(double adx, double plusDI, double minusDI, boolean trending) {
        public static AdxResult empty() {
            return new AdxResult(0, 0, 0, false);
        }
    }
}
