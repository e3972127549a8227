package com.qweather.sdk.api.indices;

import java.time.LocalDate;

public record DailyIndices(LocalDate date, int type, String name, int level, String category, String text) {
}
