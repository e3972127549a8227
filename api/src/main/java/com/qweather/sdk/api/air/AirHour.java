package com.qweather.sdk.api.air;

import java.time.OffsetDateTime;
import java.util.List;

public record AirHour(OffsetDateTime forecastTime, List<AirIndex> indexes, List<Pollutant> pollutants) {
}
