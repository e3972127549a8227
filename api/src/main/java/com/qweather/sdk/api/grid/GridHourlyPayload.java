package com.qweather.sdk.api.grid;

import java.util.List;

public record GridHourlyPayload(List<GridHourlyForecast> hourly) {
}
