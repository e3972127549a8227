package com.qweather.sdk.api.warning;

import com.qweather.sdk.core.client.QWeatherClient;
import com.qweather.sdk.core.envelope.ApiResponse;

import java.util.Map;

import static com.qweather.sdk.core.client.ArgumentChecks.notBlank;

public final class WarningApi {
    private final QWeatherClient client;

    public WarningApi(QWeatherClient client) {
        this.client = client;
    }

    public ApiResponse<WarningPayload> now(String location) {
        return notBlank("location", location)
                .<ApiResponse<WarningPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(
                        client.apiUrl("/v7/warning/now"),
                        Map.of("location", location),
                        WarningPayload.class
                ));
    }

    /**
     * Locations with at least one active warning.
     *
     * @param range country code; only {@code cn} is served today
     */
    public ApiResponse<WarningCityListPayload> cityList(String range) {
        return notBlank("range", range)
                .<ApiResponse<WarningCityListPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(
                        client.apiUrl("/v7/warning/list"),
                        Map.of("range", range),
                        WarningCityListPayload.class
                ));
    }
}
