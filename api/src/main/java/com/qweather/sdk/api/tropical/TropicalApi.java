package com.qweather.sdk.api.tropical;

import com.qweather.sdk.core.client.QWeatherClient;
import com.qweather.sdk.core.envelope.ApiResponse;

import java.util.Map;

import static com.qweather.sdk.core.client.ArgumentChecks.notBlank;

public final class TropicalApi {
    private final QWeatherClient client;

    public TropicalApi(QWeatherClient client) {
        this.client = client;
    }

    public ApiResponse<StormForecastPayload> stormForecast(String stormId) {
        return notBlank("stormId", stormId)
                .<ApiResponse<StormForecastPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(
                        client.apiUrl("/v7/tropical/storm-forecast"),
                        Map.of("stormid", stormId),
                        StormForecastPayload.class
                ));
    }
}
