package com.qweather.sdk.api.indices;

import java.util.List;

public record IndicesPayload(List<DailyIndices> daily) {
}
