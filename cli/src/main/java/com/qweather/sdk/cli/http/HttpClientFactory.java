package com.qweather.sdk.cli.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the shared {@link HttpClient}. A custom truststore is picked up from
 * {@code TRUSTSTORE_PATH} and {@code TRUSTSTORE_PASSWORD} for networks that intercept TLS.
 */
public final class HttpClientFactory {
    public static final String TRUSTSTORE_PATH_VAR = "TRUSTSTORE_PATH";
    public static final String TRUSTSTORE_PASSWORD_VAR = "TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        truststoreFrom(environment)
                .map(HttpClientFactory::sslContext)
                .ifPresent(builder::sslContext);
        return builder.build();
    }

    static Optional<Truststore> truststoreFrom(Map<String, String> environment) {
        String truststorePath = environment.get(TRUSTSTORE_PATH_VAR);
        if (truststorePath == null || truststorePath.isBlank()) {
            return Optional.empty();
        }
        String password = environment.get(TRUSTSTORE_PASSWORD_VAR);
        if (password == null) {
            throw new IllegalStateException(TRUSTSTORE_PASSWORD_VAR + " must be set when " + TRUSTSTORE_PATH_VAR + " is configured");
        }
        Path path = Path.of(truststorePath);
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }
        return Optional.of(new Truststore(path, password.toCharArray(), typeOf(path)));
    }

    private static SSLContext sslContext(Truststore truststore) {
        try (InputStream in = Files.newInputStream(truststore.path())) {
            KeyStore keyStore = KeyStore.getInstance(truststore.type());
            keyStore.load(in, truststore.password());

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(keyStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            return sslContext;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + truststore.path(), e);
        }
    }

    private static String typeOf(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }

    record Truststore(Path path, char[] password, String type) {
    }
}
