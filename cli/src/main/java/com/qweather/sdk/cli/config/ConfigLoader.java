package com.qweather.sdk.cli.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.qweather.sdk.core.client.ClientConfig;
import com.qweather.sdk.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

public final class ConfigLoader {
    public static final String ID_VAR = "QWEATHER_ID";
    public static final String KEY_VAR = "QWEATHER_KEY";
    public static final String SUBSCRIPTION_VAR = "QWEATHER_SUBSCRIPTION";
    public static final String LANG_VAR = "QWEATHER_LANG";
    public static final String UNIT_VAR = "QWEATHER_UNIT";
    public static final String API_HOST_VAR = "QWEATHER_API_HOST";
    public static final String GEO_HOST_VAR = "QWEATHER_GEO_HOST";

    private ConfigLoader() {
    }

    public static ClientConfig loadClient(Path configFile) {
        ClientSettings settings = read(configFile, new TypeReference<>() {
        });
        try {
            return settings.toClientConfig();
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new IllegalStateException("Invalid client config in " + configFile + ": " + e.getMessage(), e);
        }
    }

    public static ClientConfig fromEnvironment(Map<String, String> environment) {
        if (isBlank(environment.get(ID_VAR)) || isBlank(environment.get(KEY_VAR))) {
            throw new IllegalStateException(ID_VAR + " and " + KEY_VAR + " must be set");
        }
        ClientSettings settings = new ClientSettings(
                environment.get(ID_VAR),
                environment.get(KEY_VAR),
                parseFlag(environment.get(SUBSCRIPTION_VAR)),
                environment.get(LANG_VAR),
                environment.get(UNIT_VAR),
                environment.get(API_HOST_VAR),
                environment.get(GEO_HOST_VAR)
        );
        return settings.toClientConfig();
    }

    private static Boolean parseFlag(String value) {
        if (isBlank(value)) {
            return Boolean.FALSE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes" -> Boolean.TRUE;
            case "0", "false", "no" -> Boolean.FALSE;
            default -> throw new IllegalStateException(SUBSCRIPTION_VAR + " must be true or false but was " + value);
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
