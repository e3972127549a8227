package com.qweather.sdk.api.indices;

import com.qweather.sdk.core.client.QWeatherClient;
import com.qweather.sdk.core.envelope.ApiError;
import com.qweather.sdk.core.envelope.ApiResponse;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.qweather.sdk.core.client.ArgumentChecks.firstFailure;
import static com.qweather.sdk.core.client.ArgumentChecks.notBlank;
import static com.qweather.sdk.core.client.ArgumentChecks.oneOf;

public final class IndicesApi {
    private final QWeatherClient client;

    public IndicesApi(QWeatherClient client) {
        this.client = client;
    }

    /**
     * Life indices forecast.
     *
     * @param types index type ids; {@code "0"} asks for every type
     * @param days  1 or 3
     */
    public ApiResponse<IndicesPayload> forecast(String location, List<String> types, int days) {
        Optional<ApiError> invalidTypes = types == null || types.isEmpty()
                ? Optional.of(new ApiError.ValidationError("types is required"))
                : Optional.empty();
        return firstFailure(notBlank("location", location), invalidTypes, oneOf("days", days, 1, 3))
                .<ApiResponse<IndicesPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(
                        client.apiUrl("/v7/indices/" + days + "d"),
                        Map.of("location", location, "type", String.join(",", types)),
                        IndicesPayload.class
                ));
    }
}
