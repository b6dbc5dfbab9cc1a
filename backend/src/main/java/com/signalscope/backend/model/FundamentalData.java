package com.signalscope.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Externally supplied fundamentals summary. Ratio metrics are {@code null} when the data provider has no value.
 */
@Value
@Builder
@AllArgsConstructor
public class FundamentalData {
    @Builder.Default
    Valuation valuation = Valuation.UNKNOWN;
    @Builder.Default
    Growth growth = Growth.UNKNOWN;
    @Builder.Default
    SectorComparison sectorComparison = SectorComparison.UNKNOWN;
    Double peRatio;
    Double pbRatio;
    Double marketCap;
    Double dividendYield;
    Double eps;

    public static FundamentalData unknown() {
        return FundamentalData.builder().build();
    }

    public String verdict() {
        return valuation.name().toLowerCase() + " valuation with " + growth.name().toLowerCase() + " growth";
    }
}
