package com.qweather.sdk.api.warning;

import java.util.List;

public record WarningCityListPayload(List<LocationId> warningLocList) {
}
