package com.qweather.sdk.api.air;

public record PrimaryPollutant(String code, String name, String fullName) {
}
