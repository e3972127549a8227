package com.qweather.sdk.api;

import com.qweather.sdk.api.geo.Location;
import com.qweather.sdk.api.minutely.Minutely;
import com.qweather.sdk.api.weather.DailyForecast;
import com.qweather.sdk.api.weather.HourlyForecast;
import com.qweather.sdk.core.envelope.ShapeDiscriminator;

import java.util.List;

/**
 * Payloads of the endpoints that share one untagged response shape. The variant is chosen by the
 * list field present in the body, tried in this order:
 *
 * <ol>
 *     <li>{@link DailyList}: {@code daily}</li>
 *     <li>{@link HourlyList}: {@code hourly}</li>
 *     <li>{@link MinutelyList}: {@code minutely}</li>
 *     <li>{@link LocationList}: {@code location}</li>
 *     <li>{@link TopCityList}: {@code topCityList}</li>
 *     <li>{@link PoiList}: {@code poi}</li>
 * </ol>
 *
 * No two variants share a key field, so at most one matches a well-formed body.
 */
public sealed interface DataPayload permits
        DataPayload.DailyList,
        DataPayload.HourlyList,
        DataPayload.MinutelyList,
        DataPayload.LocationList,
        DataPayload.TopCityList,
        DataPayload.PoiList {

    ShapeDiscriminator<DataPayload> DISCRIMINATOR = ShapeDiscriminator.<DataPayload>builder("DataPayload")
            .variant("DailyList", DailyList.class, "daily")
            .variant("HourlyList", HourlyList.class, "hourly")
            .variant("MinutelyList", MinutelyList.class, "minutely")
            .variant("LocationList", LocationList.class, "location")
            .variant("TopCityList", TopCityList.class, "topCityList")
            .variant("PoiList", PoiList.class, "poi")
            .build();

    record DailyList(List<DailyForecast> daily) implements DataPayload {
    }

    record HourlyList(List<HourlyForecast> hourly) implements DataPayload {
    }

    /**
     * @param summary one-line description of the coming precipitation
     */
    record MinutelyList(String summary, List<Minutely> minutely) implements DataPayload {
    }

    record LocationList(List<Location> location) implements DataPayload {
    }

    record TopCityList(List<Location> topCityList) implements DataPayload {
    }

    record PoiList(List<Location> poi) implements DataPayload {
    }
}
