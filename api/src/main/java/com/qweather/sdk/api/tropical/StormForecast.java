package com.qweather.sdk.api.tropical;

import java.time.OffsetDateTime;

/**
 * One forecast point on a storm track. Movement fields are empty for points the provider has not
 * projected; {@code moveSpeed} then decodes to {@code null}.
 */
public record StormForecast(
        OffsetDateTime fxTime,
        double lat,
        double lon,
        String type,
        double pressure,
        double windSpeed,
        Double moveSpeed,
        String moveDir,
        String move360
) {
}
