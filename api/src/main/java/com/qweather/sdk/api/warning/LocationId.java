package com.qweather.sdk.api.warning;

public record LocationId(String locationId) {
}
