package com.qweather.sdk.api.minutely;

import com.qweather.sdk.api.DataPayload;
import com.qweather.sdk.core.client.QWeatherClient;
import com.qweather.sdk.core.envelope.ApiResponse;

import java.util.Map;

import static com.qweather.sdk.core.client.ArgumentChecks.notBlank;

public final class MinutelyApi {
    private final QWeatherClient client;

    public MinutelyApi(QWeatherClient client) {
        this.client = client;
    }

    /**
     * Two hours of precipitation in five-minute steps, returned as a {@link DataPayload.MinutelyList}.
     */
    public ApiResponse<DataPayload> precipitation(String location) {
        return notBlank("location", location)
                .<ApiResponse<DataPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(
                        client.apiUrl("/v7/minutely/5m"),
                        Map.of("location", location),
                        DataPayload.DISCRIMINATOR
                ));
    }
}
