package com.qweather.sdk.api.geo;

import com.qweather.sdk.api.DataPayload;
import com.qweather.sdk.core.client.QWeatherClient;
import com.qweather.sdk.core.envelope.ApiResponse;

import java.util.HashMap;
import java.util.Map;

import static com.qweather.sdk.core.client.ArgumentChecks.firstFailure;
import static com.qweather.sdk.core.client.ArgumentChecks.inRange;
import static com.qweather.sdk.core.client.ArgumentChecks.notBlank;

/**
 * City and POI search against the geo host. Every {@code null} argument is left out of the query.
 */
public final class GeoApi {
    private static final int MAX_RESULTS = 20;
    private static final int MAX_RADIUS_KM = 50;

    private final QWeatherClient client;

    public GeoApi(QWeatherClient client) {
        this.client = client;
    }

    /**
     * @param location city name, LocationID, adcode or {@code lon,lat}
     * @param adm      optional first-level administrative area used to disambiguate names
     * @param range    optional ISO 3166 country code
     * @param number   optional result count, 1 to 20
     * @return a {@link DataPayload.LocationList}
     */
    public ApiResponse<DataPayload> cityLookup(String location, String adm, String range, Integer number) {
        Map<String, String> params = new HashMap<>();
        params.put("location", location);
        putIfPresent(params, "adm", adm);
        putIfPresent(params, "range", range);
        putIfPresent(params, "number", number);
        return firstFailure(notBlank("location", location), inRange("number", number, 1, MAX_RESULTS))
                .<ApiResponse<DataPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(client.geoUrl("/v2/city/lookup"), params, DataPayload.DISCRIMINATOR));
    }

    /**
     * Popular cities, returned as a {@link DataPayload.TopCityList}.
     */
    public ApiResponse<DataPayload> cityTop(String range, Integer number) {
        Map<String, String> params = new HashMap<>();
        putIfPresent(params, "range", range);
        putIfPresent(params, "number", number);
        return inRange("number", number, 1, MAX_RESULTS)
                .<ApiResponse<DataPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(client.geoUrl("/v2/city/top"), params, DataPayload.DISCRIMINATOR));
    }

    /**
     * @param type POI type, e.g. {@code scenic}, {@code CSTA} or {@code TSTA}
     * @return a {@link DataPayload.PoiList}
     */
    public ApiResponse<DataPayload> poiLookup(String location, String type, String city, Integer number) {
        Map<String, String> params = new HashMap<>();
        params.put("location", location);
        params.put("type", type);
        putIfPresent(params, "city", city);
        putIfPresent(params, "number", number);
        return firstFailure(
                notBlank("location", location),
                notBlank("type", type),
                inRange("number", number, 1, MAX_RESULTS)
        )
                .<ApiResponse<DataPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(client.geoUrl("/v2/poi/lookup"), params, DataPayload.DISCRIMINATOR));
    }

    /**
     * POIs around a {@code lon,lat} point.
     *
     * @param radius optional search radius in kilometres, 1 to 50
     * @return a {@link DataPayload.PoiList}
     */
    public ApiResponse<DataPayload> poiRange(String location, String type, Double radius, Integer number) {
        Map<String, String> params = new HashMap<>();
        params.put("location", location);
        params.put("type", type);
        putIfPresent(params, "radius", radius);
        putIfPresent(params, "number", number);
        return firstFailure(
                notBlank("location", location),
                notBlank("type", type),
                inRange("radius", radius, 1, MAX_RADIUS_KM),
                inRange("number", number, 1, MAX_RESULTS)
        )
                .<ApiResponse<DataPayload>>map(ApiResponse::failure)
                .orElseGet(() -> client.requestApi(client.geoUrl("/v2/poi/range"), params, DataPayload.DISCRIMINATOR));
    }

    private static void putIfPresent(Map<String, String> params, String key, Object value) {
        if (value != null) {
            params.put(key, value instanceof Double d ? stripZeroFraction(d) : value.toString());
        }
    }

    private static String stripZeroFraction(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
