package com.qweather.sdk.api.weather;

import com.qweather.sdk.api.DataPayload;
import com.qweather.sdk.core.client.QWeatherClient;
import com.qweather.sdk.core.envelope.ApiResponse;

import java.util.Map;

import static com.qweather.sdk.core.client.ArgumentChecks.firstFailure;
import static com.qweather.sdk.core.client.ArgumentChecks.notBlank;
import static com.qweather.sdk.core.client.ArgumentChecks.oneOf;

/**
 * City weather: observed conditions plus daily and hourly forecasts. {@code location} is a
 * LocationID or a {@code lon,lat} pair.
 */
public final class WeatherApi {
    private final QWeatherClient client;

    public WeatherApi(QWeatherClient client) {
        this.client = client;
    }

    public ApiResponse<WeatherNowPayload> now(String location) {
        return notBlank("location", location)
                .<ApiResponse<WeatherNowPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(
                        client.apiUrl("/v7/weather/now"),
                        Map.of("location", location),
                        WeatherNowPayload.class
                ));
    }

    /**
     * @param days one of 3, 7, 10, 15 or 30
     * @return a {@link DataPayload.DailyList}
     */
    public ApiResponse<DataPayload> dailyForecast(String location, int days) {
        return firstFailure(notBlank("location", location), oneOf("days", days, 3, 7, 10, 15, 30))
                .<ApiResponse<DataPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(
                        client.apiUrl("/v7/weather/" + days + "d"),
                        Map.of("location", location),
                        DataPayload.DISCRIMINATOR
                ));
    }

    /**
     * @param hours one of 24, 72 or 168
     * @return a {@link DataPayload.HourlyList}
     */
    public ApiResponse<DataPayload> hourlyForecast(String location, int hours) {
        return firstFailure(notBlank("location", location), oneOf("hours", hours, 24, 72, 168))
                .<ApiResponse<DataPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(
                        client.apiUrl("/v7/weather/" + hours + "h"),
                        Map.of("location", location),
                        DataPayload.DISCRIMINATOR
                ));
    }
}
