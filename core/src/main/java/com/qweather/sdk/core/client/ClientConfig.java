package com.qweather.sdk.core.client;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable client settings, safe to share between threads.
 *
 * @param apiHost    weather data host, e.g. {@link #API_HOST} or {@link #DEV_API_HOST}
 * @param geoHost    geo lookup host
 * @param publicId   credential id sent as {@code publicid}
 * @param privateKey shared secret appended to the signing input; never sent
 * @param lang       optional response language
 * @param unit       optional unit system, {@code m} or {@code i}
 */
public record ClientConfig(
        String apiHost,
        String geoHost,
        String publicId,
        String privateKey,
        String lang,
        String unit
) {
    public static final String API_HOST = "https://api.qweather.com";
    public static final String DEV_API_HOST = "https://devapi.qweather.com";
    public static final String GEO_API_HOST = "https://geoapi.qweather.com";

    public static final String PUBLIC_ID_PARAM = "publicid";
    public static final String LANG_PARAM = "lang";
    public static final String UNIT_PARAM = "unit";

    public ClientConfig {
        apiHost = trimHost(Objects.requireNonNull(apiHost, "apiHost is required"));
        geoHost = trimHost(Objects.requireNonNull(geoHost, "geoHost is required"));
        Objects.requireNonNull(publicId, "publicId is required");
        Objects.requireNonNull(privateKey, "privateKey is required");
        if (publicId.isBlank()) {
            throw new IllegalArgumentException("publicId must not be blank");
        }
        if (privateKey.isBlank()) {
            throw new IllegalArgumentException("privateKey must not be blank");
        }
        lang = blankToNull(lang);
        unit = blankToNull(unit);
    }

    public static ClientConfig of(String publicId, String privateKey, boolean subscription) {
        return new ClientConfig(
                subscription ? API_HOST : DEV_API_HOST,
                GEO_API_HOST,
                publicId,
                privateKey,
                null,
                null
        );
    }

    public ClientConfig withLang(String newLang) {
        return new ClientConfig(apiHost, geoHost, publicId, privateKey, newLang, unit);
    }

    public ClientConfig withUnit(String newUnit) {
        return new ClientConfig(apiHost, geoHost, publicId, privateKey, lang, newUnit);
    }

    public ClientConfig withHosts(String newApiHost, String newGeoHost) {
        return new ClientConfig(newApiHost, newGeoHost, publicId, privateKey, lang, unit);
    }

    public Map<String, String> persistentParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(PUBLIC_ID_PARAM, publicId);
        if (lang != null) {
            params.put(LANG_PARAM, lang);
        }
        if (unit != null) {
            params.put(UNIT_PARAM, unit);
        }
        return params;
    }

    @Override
    public String toString() {
        return "ClientConfig[apiHost=" + apiHost
                + ", geoHost=" + geoHost
                + ", publicId=" + publicId
                + ", privateKey=****"
                + ", lang=" + lang
                + ", unit=" + unit + "]";
    }

    private static String trimHost(String host) {
        String trimmed = host.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
