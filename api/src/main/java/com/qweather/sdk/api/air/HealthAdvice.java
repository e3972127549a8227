package com.qweather.sdk.api.air;

public record HealthAdvice(String generalPopulation, String sensitivePopulation) {
}
