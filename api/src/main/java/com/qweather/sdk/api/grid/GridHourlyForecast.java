package com.qweather.sdk.api.grid;

import java.time.OffsetDateTime;

public record GridHourlyForecast(
        OffsetDateTime fxTime,
        double temp,
        String icon,
        String text,
        double wind360,
        String windDir,
        String windScale,
        double windSpeed,
        double humidity,
        double precip,
        double pressure,
        Double cloud,
        Double dew
) {
}
