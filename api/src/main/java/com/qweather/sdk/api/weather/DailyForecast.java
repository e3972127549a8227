package com.qweather.sdk.api.weather;

import java.time.LocalDate;

/**
 * One forecast day. Sun and moon times are local {@code HH:mm} strings and can be empty at high
 * latitudes; wind scales are ranges such as {@code 1-2}.
 */
public record DailyForecast(
        LocalDate fxDate,
        String sunrise,
        String sunset,
        String moonrise,
        String moonset,
        String moonPhase,
        String moonPhaseIcon,
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
        double uvIndex,
        double humidity,
        double pressure,
        double vis,
        Double cloud
) {
}
