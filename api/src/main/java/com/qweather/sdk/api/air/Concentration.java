package com.qweather.sdk.api.air;

public record Concentration(double value, String unit) {
}
