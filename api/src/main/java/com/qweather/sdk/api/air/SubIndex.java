package com.qweather.sdk.api.air;

public record SubIndex(String code, double aqi, String aqiDisplay) {
}
