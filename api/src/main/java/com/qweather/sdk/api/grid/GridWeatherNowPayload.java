package com.qweather.sdk.api.grid;

public record GridWeatherNowPayload(GridWeatherNow now) {
}
