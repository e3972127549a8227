package com.qweather.sdk.api.air;

import com.qweather.sdk.core.client.QWeatherClient;
import com.qweather.sdk.core.envelope.ApiError;
import com.qweather.sdk.core.envelope.ApiResponse;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

import static com.qweather.sdk.core.client.ArgumentChecks.firstFailure;
import static com.qweather.sdk.core.client.ArgumentChecks.inRange;
import static com.qweather.sdk.core.client.ArgumentChecks.notBlank;

/**
 * Air quality v1. Coordinates and station ids are path segments, and responses carry no
 * {@code code} field, so provider failures surface as the HTTP status.
 */
public final class AirQualityApi {
    private final QWeatherClient client;

    public AirQualityApi(QWeatherClient client) {
        this.client = client;
    }

    public ApiResponse<AirCurrentPayload> current(double latitude, double longitude) {
        return byCoordinates("current", latitude, longitude, AirCurrentPayload.class);
    }

    public ApiResponse<AirHourlyPayload> hourlyForecast(double latitude, double longitude) {
        return byCoordinates("hourly", latitude, longitude, AirHourlyPayload.class);
    }

    public ApiResponse<AirDailyPayload> dailyForecast(double latitude, double longitude) {
        return byCoordinates("daily", latitude, longitude, AirDailyPayload.class);
    }

    public ApiResponse<AirStationPayload> station(String locationId) {
        Optional<ApiError> invalid = notBlank("locationId", locationId)
                .or(() -> locationId.matches("[A-Za-z0-9_-]+")
                        ? Optional.empty()
                        : Optional.of(new ApiError.ValidationError("locationId must be a plain id but was " + locationId)));
        return invalid
                .<ApiResponse<AirStationPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(
                        client.apiUrl("/airquality/v1/station/" + locationId),
                        Map.of(),
                        AirStationPayload.class
                ));
    }

    private <T> ApiResponse<T> byCoordinates(String kind, double latitude, double longitude, Class<T> type) {
        return firstFailure(inRange("latitude", latitude, -90, 90), inRange("longitude", longitude, -180, 180))
                .<ApiResponse<T>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(
                        client.apiUrl("/airquality/v1/" + kind + "/" + coordinate(latitude) + "/" + coordinate(longitude)),
                        Map.of(),
                        type
                ));
    }

    private static String coordinate(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
