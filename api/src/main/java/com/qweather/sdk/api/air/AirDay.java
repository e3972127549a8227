package com.qweather.sdk.api.air;

import java.time.OffsetDateTime;
import java.util.List;

public record AirDay(
        OffsetDateTime forecastStartTime,
        OffsetDateTime forecastEndTime,
        List<AirIndex> indexes,
        List<Pollutant> pollutants
) {
}
