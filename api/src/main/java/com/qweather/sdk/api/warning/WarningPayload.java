package com.qweather.sdk.api.warning;

import java.util.List;

public record WarningPayload(List<WeatherWarning> warning) {
}
