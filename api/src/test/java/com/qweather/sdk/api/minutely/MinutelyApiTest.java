package com.qweather.sdk.api.minutely;

import com.qweather.sdk.api.DataPayload;
import com.qweather.sdk.api.support.ProviderStub;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class MinutelyApiTest {
    private ProviderStub stub;

    @BeforeEach
    void setUp() throws Exception {
        stub = ProviderStub.start().route("/v7/minutely/5m", "minutely.json");
    }

    @AfterEach
    void tearDown() {
        stub.close();
    }

    @Test
    void precipitationResolvesToMinutelyList() {
        DataPayload payload = stub.qweather().minutely().precipitation("116.38,39.91").orElseThrow();

        DataPayload.MinutelyList list = assertInstanceOf(DataPayload.MinutelyList.class, payload);
        Minutely first = list.minutely().get(0);
        assertEquals(OffsetDateTime.parse("2021-12-16T18:55+08:00"), first.fxTime());
        assertEquals("rain", first.type());
        assertEquals("116.38,39.91", stub.lastRequest().query().get("location"));
    }
}
