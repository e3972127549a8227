package com.qweather.sdk.api.tropical;

import java.util.List;

public record StormForecastPayload(List<StormForecast> forecast) {
}
