package com.qweather.sdk.core.client;

import com.qweather.sdk.core.envelope.ApiError;
import com.qweather.sdk.core.envelope.ApiResponse;
import com.qweather.sdk.core.envelope.EnvelopeResolver;
import com.qweather.sdk.core.envelope.PayloadDecoder;
import com.qweather.sdk.core.signing.RequestSigner;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;

/**
 * Signs, sends and resolves provider requests. Holds only immutable state, so one instance can serve
 * concurrent callers; every call builds and signs its own parameter map.
 */
public final class QWeatherClient {
    public static final String TIMESTAMP_PARAM = "t";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final Logger LOGGER = Logger.getLogger(QWeatherClient.class.getName());

    private final ClientConfig config;
    private final HttpClient httpClient;
    private final Duration timeout;
    private final Clock clock;
    private final RequestSigner signer;
    private final EnvelopeResolver resolver = new EnvelopeResolver();

    public QWeatherClient(ClientConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build(), DEFAULT_TIMEOUT, Clock.systemUTC());
    }

    public QWeatherClient(ClientConfig config, HttpClient httpClient, Duration timeout, Clock clock) {
        this(config, httpClient, timeout, clock, new RequestSigner(config.privateKey()));
    }

    public QWeatherClient(ClientConfig config, HttpClient httpClient, Duration timeout, Clock clock, RequestSigner signer) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.signer = Objects.requireNonNull(signer, "signer is required");
    }

    public ClientConfig config() {
        return config;
    }

    public String apiUrl(String path) {
        return config.apiHost() + path;
    }

    public String geoUrl(String path) {
        return config.geoHost() + path;
    }

    /**
     * Request params merged with the persistent client params (client values win), stamped with the
     * current epoch second and signed.
     */
    public Map<String, String> signedParams(Map<String, String> params) {
        Map<String, String> merged = new TreeMap<>(params);
        merged.putAll(config.persistentParams());
        merged.put(TIMESTAMP_PARAM, String.valueOf(clock.instant().getEpochSecond()));
        return signer.signInto(merged);
    }

    public <T> ApiResponse<T> requestApi(String url, Map<String, String> params, Class<T> type) {
        return requestApi(url, params, PayloadDecoder.of(type));
    }

    public <T> ApiResponse<T> requestApi(String url, Map<String, String> params, PayloadDecoder<T> decoder) {
        HttpRequest request = buildRequest(url, params);
        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            return resolve(request, response, decoder);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return transportFailure(request, e);
        } catch (IOException e) {
            return transportFailure(request, e);
        }
    }

    public <T> CompletableFuture<ApiResponse<T>> requestApiAsync(
            String url,
            Map<String, String> params,
            PayloadDecoder<T> decoder
    ) {
        HttpRequest request = buildRequest(url, params);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .handle((response, error) -> error == null
                        ? resolve(request, response, decoder)
                        : transportFailure(request, unwrap(error)));
    }

    HttpRequest buildRequest(String url, Map<String, String> params) {
        Map<String, String> signed = signedParams(params);
        String query = signed.entrySet().stream()
                .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
                .collect(Collectors.joining("&"));
        URI uri = URI.create(url + (url.contains("?") ? "&" : "?") + query);
        LOGGER.fine(() -> "GET " + uri);
        return HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("Accept-Encoding", "gzip")
                .build();
    }

    private <T> ApiResponse<T> resolve(HttpRequest request, HttpResponse<byte[]> response, PayloadDecoder<T> decoder) {
        String body;
        try {
            body = readBody(response);
        } catch (IOException e) {
            return transportFailure(request, e);
        }
        return resolver.resolve(response.statusCode(), body, decoder);
    }

    private static String readBody(HttpResponse<byte[]> response) throws IOException {
        byte[] raw = response.body() == null ? new byte[0] : response.body();
        boolean gzip = response.headers()
                .firstValue("Content-Encoding")
                .map(value -> value.trim().equalsIgnoreCase("gzip"))
                .orElse(false);
        if (!gzip) {
            return new String(raw, StandardCharsets.UTF_8);
        }
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private <T> ApiResponse<T> transportFailure(HttpRequest request, Throwable error) {
        String description;
        if (error instanceof HttpTimeoutException) {
            description = "Request timed out after " + timeout.toMillis() + " ms";
        } else if (error instanceof InterruptedException) {
            description = "Request interrupted";
        } else {
            String message = error.getMessage();
            description = error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
        }
        LOGGER.log(Level.WARNING, "Request to " + request.uri().getPath() + " failed: " + description, error);
        return ApiResponse.failure(new ApiError.TransportError(description));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
