package com.qweather.sdk.core.signing;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the signing input: entries sorted by the UTF-8 bytes of their key, reserved keys and empty
 * values dropped, emitted as {@code key=value} pairs joined by {@code &}.
 */
public final class ParamCanonicalizer {
    public static final String SIGNATURE_KEY = "sign";
    public static final String CREDENTIAL_KEY = "key";

    static final Comparator<String> BYTEWISE = (left, right) -> Arrays.compareUnsigned(
            left.getBytes(StandardCharsets.UTF_8),
            right.getBytes(StandardCharsets.UTF_8)
    );

    private ParamCanonicalizer() {
    }

    public static String canonicalize(Map<String, String> params) {
        return params.entrySet().stream()
                .filter(entry -> !isReserved(entry.getKey()))
                .filter(entry -> entry.getValue() != null && !entry.getValue().isEmpty())
                .sorted(Map.Entry.comparingByKey(BYTEWISE))
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("&"));
    }

    static boolean isReserved(String key) {
        String lowered = key.toLowerCase(Locale.ROOT);
        return lowered.equals(SIGNATURE_KEY) || lowered.equals(CREDENTIAL_KEY);
    }
}
