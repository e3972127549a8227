package com.qweather.sdk.core.client;

import com.qweather.sdk.core.envelope.ApiError;

public class QWeatherException extends RuntimeException {
    private final ApiError error;

    public QWeatherException(ApiError error) {
        super(error.description());
        this.error = error;
    }

    public ApiError error() {
        return error;
    }
}
