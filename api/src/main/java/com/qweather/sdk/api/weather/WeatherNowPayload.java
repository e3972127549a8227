package com.qweather.sdk.api.weather;

public record WeatherNowPayload(WeatherNow now) {
}
