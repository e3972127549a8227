package com.qweather.sdk.api.grid;

import java.time.LocalDate;

public record GridDailyForecast(
        LocalDate fxDate,
        double tempMax,
        double tempMin,
        String iconDay,
        String textDay,
        String iconNight,
        String textNight,
        double wind360Day,
        String windDirDay,
        String windScaleDay,
        double windSpeedDay,
        double wind360Night,
        String windDirNight,
        String windScaleNight,
        double windSpeedNight,
        double precip,
        double humidity,
        double pressure
) {
}
