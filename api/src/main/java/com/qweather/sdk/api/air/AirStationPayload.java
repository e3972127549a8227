package com.qweather.sdk.api.air;

import java.util.List;

public record AirStationPayload(Metadata metadata, List<Pollutant> pollutants) {
}
