package com.qweather.sdk.api.air;

import java.util.List;

public record Pollutant(
        String code,
        String name,
        String fullName,
        Concentration concentration,
        List<SubIndex> subIndexes
) {
}
