package com.jay.mfses;

import com.jay.mfses.model.PricePoint;
import com.jay.mfses.model.SecuritySnapshot;
import com.jay.mfses.model.enums.Sector;

import java.time.LocalDateTime;
import java.util.List;

/** Shared snapshot fixtures for engine tests. */
public final class TestSnapshots {

    public static final LocalDateTime T0 = LocalDateTime.of(2025, 1, 6, 16, 0);

    private TestSnapshots() {}

    /**
     * Mega-cap technology name: $2.5T cap, 15% EPS growth, D/E 0.2, EPS 6.00 with 12%
     * expected growth at a $180 price, 0.5% yield and a single history point.
     */
    public static SecuritySnapshot megaCapTech() {
        return SecuritySnapshot.builder()
            .ticker("MEGA")
            .name("Mega Tech Corp")
            .marketCap(2.5e12)
            .epsGrowthRate(15.0)
            .debtToEquity(0.2)
            .trailingEps(6.0)
            .expectedGrowthRate(12.0)
            .currentPrice(180.0)
            .dividendYield(0.5)
            .sector(Sector.TECHNOLOGY)
            .recentPriceHistory(List.of(new PricePoint(T0, 180.0, 1_000_000L)))
            .build();
    }

    public static SecuritySnapshot withTicker(String ticker) {
        return megaCapTech().toBuilder().ticker(ticker).build();
    }

    public static List<PricePoint> history(double... prices) {
        PricePoint[] points = new PricePoint[prices.length];
        for (int i = 0; i < prices.length; i++) {
            points[i] = PricePoint.of(T0.plusDays(i), prices[i]);
        }
        return List.of(points);
    }
}
