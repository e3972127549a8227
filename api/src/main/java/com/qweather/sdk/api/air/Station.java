package com.qweather.sdk.api.air;

public record Station(String id, String name) {
}
