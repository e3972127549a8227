package com.qweather.sdk.cli.config;

import com.qweather.sdk.core.client.ClientConfig;

/**
 * Raw client settings as they appear in a config file or the environment. Hosts default from
 * {@code subscription} when left out.
 */
public record ClientSettings(
        String publicId,
        String privateKey,
        Boolean subscription,
        String lang,
        String unit,
        String apiHost,
        String geoHost
) {
    public ClientConfig toClientConfig() {
        if (isBlank(publicId) || isBlank(privateKey)) {
            throw new IllegalStateException("publicId and privateKey are required");
        }
        ClientConfig config = ClientConfig.of(publicId, privateKey, Boolean.TRUE.equals(subscription))
                .withLang(lang)
                .withUnit(unit);
        if (!isBlank(apiHost) || !isBlank(geoHost)) {
            config = config.withHosts(
                    isBlank(apiHost) ? config.apiHost() : apiHost,
                    isBlank(geoHost) ? config.geoHost() : geoHost
            );
        }
        return config;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
