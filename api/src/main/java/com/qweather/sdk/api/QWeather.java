package com.qweather.sdk.api;

import com.qweather.sdk.api.air.AirQualityApi;
import com.qweather.sdk.api.geo.GeoApi;
import com.qweather.sdk.api.grid.GridWeatherApi;
import com.qweather.sdk.api.indices.IndicesApi;
import com.qweather.sdk.api.minutely.MinutelyApi;
import com.qweather.sdk.api.tropical.TropicalApi;
import com.qweather.sdk.api.warning.WarningApi;
import com.qweather.sdk.api.weather.WeatherApi;
import com.qweather.sdk.core.client.ClientConfig;
import com.qweather.sdk.core.client.QWeatherClient;

import java.util.Objects;

/**
 * Entry point grouping every endpoint family over one shared {@link QWeatherClient}.
 */
public final class QWeather {
    private final QWeatherClient client;
    private final WeatherApi weather;
    private final MinutelyApi minutely;
    private final GridWeatherApi gridWeather;
    private final GeoApi geo;
    private final WarningApi warning;
    private final IndicesApi indices;
    private final TropicalApi tropical;
    private final AirQualityApi airQuality;

    public QWeather(QWeatherClient client) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.weather = new WeatherApi(client);
        this.minutely = new MinutelyApi(client);
        this.gridWeather = new GridWeatherApi(client);
        this.geo = new GeoApi(client);
        this.warning = new WarningApi(client);
        this.indices = new IndicesApi(client);
        this.tropical = new TropicalApi(client);
        this.airQuality = new AirQualityApi(client);
    }

    public static QWeather create(ClientConfig config) {
        return new QWeather(new QWeatherClient(config));
    }

    public QWeatherClient client() {
        return client;
    }

    public WeatherApi weather() {
        return weather;
    }

    public MinutelyApi minutely() {
        return minutely;
    }

    public GridWeatherApi gridWeather() {
        return gridWeather;
    }

    public GeoApi geo() {
        return geo;
    }

    public WarningApi warning() {
        return warning;
    }

    public IndicesApi indices() {
        return indices;
    }

    public TropicalApi tropical() {
        return tropical;
    }

    public AirQualityApi airQuality() {
        return airQuality;
    }
}
