package com.qweather.sdk.api.weather;

import java.time.OffsetDateTime;

public record HourlyForecast(
        OffsetDateTime fxTime,
        double temp,
        String icon,
        String text,
        double wind360,
        String windDir,
        String windScale,
        double windSpeed,
        double humidity,
        Double pop,
        double precip,
        double pressure,
        Double cloud,
        Double dew
) {
}
