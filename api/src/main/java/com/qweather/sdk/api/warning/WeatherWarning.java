package com.qweather.sdk.api.warning;

import java.time.OffsetDateTime;

/**
 * An active warning. {@code startTime} and {@code endTime} are sent as empty strings when the
 * issuer leaves them open and decode to {@code null}.
 */
public record WeatherWarning(
        String id,
        String sender,
        OffsetDateTime pubTime,
        String title,
        OffsetDateTime startTime,
        OffsetDateTime endTime,
        String status,
        String severity,
        String severityColor,
        String type,
        String typeName,
        String urgency,
        String certainty,
        String text,
        String related
) {
}
