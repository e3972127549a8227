package com.qweather.sdk.api.grid;

import java.util.List;

public record GridDailyPayload(List<GridDailyForecast> daily) {
}
