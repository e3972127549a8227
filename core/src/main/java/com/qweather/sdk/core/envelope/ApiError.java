package com.qweather.sdk.core.envelope;

public sealed interface ApiError permits
        ApiError.TransportError,
        ApiError.ProviderError,
        ApiError.DecodeError,
        ApiError.ValidationError {

    String description();

    /**
     * Connection, TLS, timeout or a body that is not JSON.
     */
    record TransportError(String description) implements ApiError {
    }

    /**
     * Non-success status code exactly as the provider sent it.
     */
    record ProviderError(String code) implements ApiError {
        @Override
        public String description() {
            return "Provider returned status " + code;
        }
    }

    record DecodeError(String description) implements ApiError {
    }

    /**
     * Caller argument rejected before any request was sent.
     */
    record ValidationError(String description) implements ApiError {
    }
}
