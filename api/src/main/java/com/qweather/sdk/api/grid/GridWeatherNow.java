package com.qweather.sdk.api.grid;

import java.time.OffsetDateTime;

public record GridWeatherNow(
        OffsetDateTime obsTime,
        double temp,
        String icon,
        String text,
        double wind360,
        String windDir,
        double windScale,
        double windSpeed,
        double humidity,
        double precip,
        double pressure,
        Double cloud,
        Double dew
) {
}
