package com.qweather.sdk.core.client;

import com.qweather.sdk.core.envelope.ApiError;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

public final class ArgumentChecks {
    private ArgumentChecks() {
    }

    public static Optional<ApiError> oneOf(String name, int value, int... allowed) {
        if (Arrays.stream(allowed).anyMatch(candidate -> candidate == value)) {
            return Optional.empty();
        }
        String choices = Arrays.stream(allowed).mapToObj(String::valueOf).collect(Collectors.joining(", "));
        return Optional.of(new ApiError.ValidationError(name + " must be one of [" + choices + "] but was " + value));
    }

    public static Optional<ApiError> inRange(String name, Number value, double min, double max) {
        if (value == null) {
            return Optional.empty();
        }
        double numeric = value.doubleValue();
        if (numeric >= min && numeric <= max) {
            return Optional.empty();
        }
        return Optional.of(new ApiError.ValidationError(
                name + " must be between " + format(min) + " and " + format(max) + " but was " + value
        ));
    }

    public static Optional<ApiError> notBlank(String name, String value) {
        if (value != null && !value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new ApiError.ValidationError(name + " is required"));
    }

    @SafeVarargs
    public static Optional<ApiError> firstFailure(Optional<ApiError>... checks) {
        return Arrays.stream(checks)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .findFirst();
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
