package com.qweather.sdk.cli.http;

import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpClientFactoryTest {
    @Test
    void createsDefaultClientWithoutTruststore() {
        HttpClient client = HttpClientFactory.create(Duration.ofMillis(200), Map.of());

        assertNotNull(client);
        assertEquals(HttpClient.Redirect.NORMAL, client.followRedirects());
        assertTrue(client.connectTimeout().isPresent());
    }

    @Test
    void missingTruststoreFileFailsFast() {
        Map<String, String> env = Map.of(
                "TRUSTSTORE_PATH", "/tmp/qweather-missing-truststore.jks",
                "TRUSTSTORE_PASSWORD", "changeit"
        );

        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> HttpClientFactory.create(Duration.ofMillis(200), env)
        );
        assertTrue(ex.getMessage().contains("Truststore file does not exist"));
    }

    @Test
    void truststoreWithoutPasswordIsRejected() throws Exception {
        Path truststore = Files.createTempFile("truststore-", ".jks");

        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> HttpClientFactory.create(Duration.ofMillis(200), Map.of("TRUSTSTORE_PATH", truststore.toString()))
        );
        assertTrue(ex.getMessage().contains("TRUSTSTORE_PASSWORD must be set"));
    }

    @Test
    void storeTypeFollowsFileExtension() throws Exception {
        Path jks = Files.createTempFile("truststore-", ".jks");
        Path p12 = Files.createTempFile("truststore-", ".p12");

        assertEquals("JKS", HttpClientFactory.truststoreFrom(Map.of(
                "TRUSTSTORE_PATH", jks.toString(),
                "TRUSTSTORE_PASSWORD", "changeit"
        )).orElseThrow().type());
        assertEquals("PKCS12", HttpClientFactory.truststoreFrom(Map.of(
                "TRUSTSTORE_PATH", p12.toString(),
                "TRUSTSTORE_PASSWORD", "changeit"
        )).orElseThrow().type());
    }

    @Test
    void createsClientWithJksTruststore() throws Exception {
        Path truststore = Files.createTempFile("truststore-", ".jks");
        writeEmptyTruststore(truststore, "JKS", "changeit".toCharArray());

        HttpClient client = HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                "TRUSTSTORE_PATH", truststore.toString(),
                "TRUSTSTORE_PASSWORD", "changeit"
        ));

        assertNotNull(client);
    }

    @Test
    void createsClientWithPkcs12Truststore() throws Exception {
        Path truststore = Files.createTempFile("truststore-", ".p12");
        writeEmptyTruststore(truststore, "PKCS12", "changeit".toCharArray());

        HttpClient client = HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                "TRUSTSTORE_PATH", truststore.toString(),
                "TRUSTSTORE_PASSWORD", "changeit"
        ));

        assertNotNull(client);
    }

    @Test
    void wrongPasswordReportsTruststorePath() throws Exception {
        Path truststore = Files.createTempFile("truststore-", ".jks");
        writeEmptyTruststore(truststore, "JKS", "correct-password".toCharArray());

        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                        "TRUSTSTORE_PATH", truststore.toString(),
                        "TRUSTSTORE_PASSWORD", "wrong-password"
                ))
        );
        assertTrue(ex.getMessage().contains("Failed to build SSL context from truststore"));
        assertTrue(ex.getMessage().contains(truststore.toString()));
    }

    private static void writeEmptyTruststore(Path file, String type, char[] password) throws Exception {
        KeyStore keyStore = KeyStore.getInstance(type);
        keyStore.load(null, password);
        try (OutputStream out = Files.newOutputStream(file)) {
            keyStore.store(out, password);
        }
    }
}
