package com.qweather.sdk.api.air;

/**
 * One air quality index value, e.g. {@code us-epa} or the provider's own {@code qaqi}.
 * {@code primaryPollutant} is absent when no pollutant dominates.
 */
public record AirIndex(
        String code,
        String name,
        double aqi,
        String aqiDisplay,
        int level,
        String category,
        Rgba color,
        PrimaryPollutant primaryPollutant,
        Health health
) {
}
