package com.qweather.sdk.api.grid;

import com.qweather.sdk.core.client.QWeatherClient;
import com.qweather.sdk.core.envelope.ApiResponse;

import java.util.Map;

import static com.qweather.sdk.core.client.ArgumentChecks.firstFailure;
import static com.qweather.sdk.core.client.ArgumentChecks.notBlank;
import static com.qweather.sdk.core.client.ArgumentChecks.oneOf;

/**
 * Grid-point weather at roughly 3-5 km resolution. {@code location} must be a {@code lon,lat} pair.
 */
public final class GridWeatherApi {
    private final QWeatherClient client;

    public GridWeatherApi(QWeatherClient client) {
        this.client = client;
    }

    public ApiResponse<GridWeatherNowPayload> now(String location) {
        return notBlank("location", location)
                .<ApiResponse<GridWeatherNowPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(
                        client.apiUrl("/v7/grid-weather/now"),
                        Map.of("location", location),
                        GridWeatherNowPayload.class
                ));
    }

    public ApiResponse<GridDailyPayload> dailyForecast(String location, int days) {
        return firstFailure(notBlank("location", location), oneOf("days", days, 3, 7))
                .<ApiResponse<GridDailyPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(
                        client.apiUrl("/v7/grid-weather/" + days + "d"),
                        Map.of("location", location),
                        GridDailyPayload.class
                ));
    }

    public ApiResponse<GridHourlyPayload> hourlyForecast(String location, int hours) {
        return firstFailure(notBlank("location", location), oneOf("hours", hours, 24, 72))
                .<ApiResponse<GridHourlyPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(
                        client.apiUrl("/v7/grid-weather/" + hours + "h"),
                        Map.of("location", location),
                        GridHourlyPayload.class
                ));
    }
}
