package com.qweather.sdk.core.envelope;

import java.io.IOException;
import java.util.List;
import java.util.Set;

public class ShapeMismatchException extends IOException {
    private final List<String> triedVariants;

    public ShapeMismatchException(String discriminator, List<String> triedVariants, Set<String> presentFields) {
        super(discriminator + " matched none of " + triedVariants + " (fields present: " + presentFields + ")");
        this.triedVariants = List.copyOf(triedVariants);
    }

    public List<String> triedVariants() {
        return triedVariants;
    }
}
