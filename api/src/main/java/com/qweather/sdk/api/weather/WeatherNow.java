package com.qweather.sdk.api.weather;

import java.time.OffsetDateTime;

/**
 * Observed conditions. {@code cloud} and {@code dew} may be missing for some stations.
 */
public record WeatherNow(
        OffsetDateTime obsTime,
        double temp,
        double feelsLike,
        String icon,
        String text,
        double wind360,
        String windDir,
        double windScale,
        double windSpeed,
        double humidity,
        double precip,
        double pressure,
        double vis,
        Double cloud,
        Double dew
) {
}
