package com.qweather.sdk.api.air;

public record Rgba(int red, int green, int blue, double alpha) {
}
