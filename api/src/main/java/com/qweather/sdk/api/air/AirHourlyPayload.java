package com.qweather.sdk.api.air;

import java.util.List;

public record AirHourlyPayload(Metadata metadata, List<AirHour> hours) {
}
