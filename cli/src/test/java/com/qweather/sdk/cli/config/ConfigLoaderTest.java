package com.qweather.sdk.cli.config;

import com.qweather.sdk.core.client.ClientConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsClientConfigFromFile() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Path file = dir.resolve("qweather.json");
        Files.writeString(file, """
                {
                  "publicId": "HE1234",
                  "privateKey": "secret",
                  "subscription": true,
                  "lang": "en",
                  "unit": "i"
                }
                """);

        ClientConfig config = ConfigLoader.loadClient(file);

        assertEquals(ClientConfig.API_HOST, config.apiHost());
        assertEquals(ClientConfig.GEO_API_HOST, config.geoHost());
        assertEquals("HE1234", config.publicId());
        assertEquals("en", config.lang());
        assertEquals("i", config.unit());
    }

    @Test
    void explicitHostsOverrideDefaults() throws Exception {
        Path file = Files.createTempFile("qweather-", ".json");
        Files.writeString(file, """
                {"publicId":"id1","privateKey":"key1","apiHost":"http://localhost:8080/"}
                """);

        ClientConfig config = ConfigLoader.loadClient(file);

        assertEquals("http://localhost:8080", config.apiHost());
        assertEquals(ClientConfig.GEO_API_HOST, config.geoHost());
        assertNull(config.lang());
    }

    @Test
    void missingOrInvalidConfigFailsFastWithPathInMessage() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-invalid-");
        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{not-json");

        IllegalStateException invalid = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadClient(broken));
        assertTrue(invalid.getMessage().contains("broken.json"));

        IllegalStateException missing = assertThrows(
                IllegalStateException.class,
                () -> ConfigLoader.loadClient(dir.resolve("absent.json"))
        );
        assertTrue(missing.getMessage().contains("absent.json"));
    }

    @Test
    void configWithoutCredentialsIsRejected() throws Exception {
        Path file = Files.createTempFile("qweather-", ".json");
        Files.writeString(file, """
                {"publicId":"id1"}
                """);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadClient(file));
        assertTrue(ex.getMessage().contains("Invalid client config"));
    }

    @Test
    void readsEnvironment() {
        ClientConfig config = ConfigLoader.fromEnvironment(Map.of(
                "QWEATHER_ID", "id1",
                "QWEATHER_KEY", "key1",
                "QWEATHER_SUBSCRIPTION", "no",
                "QWEATHER_LANG", "zh",
                "QWEATHER_GEO_HOST", "http://localhost:9000"
        ));

        assertEquals(ClientConfig.DEV_API_HOST, config.apiHost());
        assertEquals("http://localhost:9000", config.geoHost());
        assertEquals("zh", config.lang());
        assertNull(config.unit());
    }

    @Test
    void environmentWithoutCredentialsFails() {
        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> ConfigLoader.fromEnvironment(Map.of("QWEATHER_ID", "id1"))
        );
        assertTrue(ex.getMessage().contains("QWEATHER_KEY"));
    }

    @Test
    void unreadableSubscriptionFlagFails() {
        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> ConfigLoader.fromEnvironment(Map.of(
                        "QWEATHER_ID", "id1",
                        "QWEATHER_KEY", "key1",
                        "QWEATHER_SUBSCRIPTION", "maybe"
                ))
        );
        assertTrue(ex.getMessage().contains("QWEATHER_SUBSCRIPTION"));
    }
}
