package com.qweather.sdk.core.envelope;

import java.time.OffsetDateTime;

/**
 * One decoded response. The metadata fields depend on the endpoint family and may be {@code null}:
 * dynamic weather data carries all four, geo data only {@code code} and {@code refer}, and the v1
 * air quality endpoints none of them.
 */
public record Envelope<T>(
        String code,
        OffsetDateTime updateTime,
        String fxLink,
        Refer refer,
        T payload
) {
}
