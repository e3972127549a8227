package com.qweather.sdk.core.envelope;

import java.util.List;

public record Refer(List<String> sources, List<String> license) {
    public Refer {
        sources = sources == null ? List.of() : List.copyOf(sources);
        license = license == null ? List.of() : List.copyOf(license);
    }
}
