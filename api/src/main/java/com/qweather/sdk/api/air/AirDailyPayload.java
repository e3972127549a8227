package com.qweather.sdk.api.air;

import java.util.List;

public record AirDailyPayload(Metadata metadata, List<AirDay> days) {
}
