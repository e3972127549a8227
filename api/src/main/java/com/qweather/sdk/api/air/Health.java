package com.qweather.sdk.api.air;

public record Health(String effect, HealthAdvice advice) {
}
