package com.qweather.sdk.api.weather;

import com.qweather.sdk.api.DataPayload;
import com.qweather.sdk.api.support.ProviderStub;
import com.qweather.sdk.core.envelope.ApiError;
import com.qweather.sdk.core.envelope.ApiResponse;
import com.qweather.sdk.core.envelope.Envelope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeatherApiTest {
    private ProviderStub stub;
    private WeatherApi api;

    @BeforeEach
    void setUp() throws Exception {
        stub = ProviderStub.start()
                .route("/v7/weather/now", "weather-now.json")
                .route("/v7/weather/7d", "weather-daily.json")
                .route("/v7/weather/24h", "weather-hourly.json");
        api = stub.qweather().weather();
    }

    @AfterEach
    void tearDown() {
        stub.close();
    }

    @Test
    void nowDecodesStringNumbersAndEnvelope() {
        ApiResponse<WeatherNowPayload> response = api.now("101010100");

        Envelope<WeatherNowPayload> envelope = response.envelope().orElseThrow();
        assertEquals("200", envelope.code());
        assertEquals(OffsetDateTime.parse("2020-06-30T22:00+08:00"), envelope.updateTime());
        assertEquals(List.of("QWeather", "NMC", "ECMWF"), envelope.refer().sources());
        WeatherNow now = envelope.payload().now();
        assertEquals(24.0, now.temp());
        assertEquals(72.0, now.humidity());
        assertNull(now.cloud());
        assertEquals(21.0, now.dew());

        ProviderStub.RecordedRequest request = stub.lastRequest();
        assertEquals("101010100", request.query().get("location"));
        assertEquals("id1", request.query().get("publicid"));
        assertEquals("1700000000", request.query().get("t"));
        assertTrue(request.query().get("sign").matches("[0-9a-f]{32}"));
    }

    @Test
    void dailyForecastResolvesToDailyList() {
        DataPayload payload = api.dailyForecast("101010100", 7).orElseThrow();

        DataPayload.DailyList daily = assertInstanceOf(DataPayload.DailyList.class, payload);
        assertEquals(2, daily.daily().size());
        DailyForecast first = daily.daily().get(0);
        assertEquals(LocalDate.of(2021, 11, 15), first.fxDate());
        assertEquals(-1.0, first.tempMin());
        assertEquals("1-2", first.windScaleDay());
        assertNull(daily.daily().get(1).cloud());
    }

    @Test
    void hourlyForecastResolvesToHourlyList() {
        DataPayload payload = api.hourlyForecast("116.41,39.92", 24).orElseThrow();

        DataPayload.HourlyList hourly = assertInstanceOf(DataPayload.HourlyList.class, payload);
        assertEquals(0.0, hourly.hourly().get(0).pop());
        assertNull(hourly.hourly().get(1).pop());
        assertEquals("116.41,39.92", stub.lastRequest().query().get("location"));
    }

    @Test
    void unsupportedRangesFailBeforeAnyRequest() {
        ApiError days = api.dailyForecast("101010100", 5).error().orElseThrow();
        ApiError hours = api.hourlyForecast("101010100", 48).error().orElseThrow();
        ApiError location = api.now(" ").error().orElseThrow();

        assertInstanceOf(ApiError.ValidationError.class, days);
        assertInstanceOf(ApiError.ValidationError.class, hours);
        assertInstanceOf(ApiError.ValidationError.class, location);
        assertTrue(stub.requests().isEmpty());
    }

    @Test
    void unknownLocationSurfacesProviderCode() {
        ApiResponse<DataPayload> response = api.dailyForecast("101010100", 3);

        assertEquals(new ApiError.ProviderError("404"), response.error().orElseThrow());
        assertEquals("/v7/weather/3d", stub.lastRequest().path());
    }
}
