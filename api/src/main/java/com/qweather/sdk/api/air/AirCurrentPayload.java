package com.qweather.sdk.api.air;

import java.util.List;

public record AirCurrentPayload(
        Metadata metadata,
        List<AirIndex> indexes,
        List<Pollutant> pollutants,
        List<Station> stations
) {
}
