package com.qweather.sdk.api.minutely;

import java.time.OffsetDateTime;

/**
 * Five-minute precipitation slot.
 *
 * @param precip accumulated precipitation in millimetres
 * @param type   {@code rain} or {@code snow}
 */
public record Minutely(OffsetDateTime fxTime, double precip, String type) {
}
