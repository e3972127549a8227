package com.qweather.sdk.api.geo;

/**
 * A city or point of interest. The provider sends coordinates, {@code isDst} and {@code rank} as
 * strings.
 */
public record Location(
        String name,
        String id,
        double lat,
        double lon,
        String adm2,
        String adm1,
        String country,
        String tz,
        String utcOffset,
        boolean isDst,
        String type,
        int rank,
        String fxLink
) {
}
