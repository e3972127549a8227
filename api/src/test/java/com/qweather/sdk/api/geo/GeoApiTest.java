package com.qweather.sdk.api.geo;

import com.qweather.sdk.api.DataPayload;
import com.qweather.sdk.api.support.ProviderStub;
import com.qweather.sdk.core.envelope.ApiError;
import com.qweather.sdk.core.envelope.Envelope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoApiTest {
    private ProviderStub stub;
    private GeoApi api;

    @BeforeEach
    void setUp() throws Exception {
        stub = ProviderStub.start()
                .route("/v2/city/lookup", "city-lookup.json")
                .route("/v2/city/top", "city-top.json")
                .route("/v2/poi/lookup", "poi.json")
                .route("/v2/poi/range", "poi.json");
        api = stub.qweather().geo();
    }

    @AfterEach
    void tearDown() {
        stub.close();
    }

    @Test
    void cityLookupDecodesStringTypedFields() {
        Envelope<DataPayload> envelope = api.cityLookup("北京", "beijing", "cn", 2).envelope().orElseThrow();

        assertNull(envelope.updateTime());
        DataPayload.LocationList list = assertInstanceOf(DataPayload.LocationList.class, envelope.payload());
        Location beijing = list.location().get(0);
        assertEquals("101010100", beijing.id());
        assertEquals(39.90499, beijing.lat());
        assertFalse(beijing.isDst());
        assertEquals(10, beijing.rank());
        assertEquals("city", beijing.type());

        Map<String, String> query = stub.lastRequest().query();
        assertEquals("北京", query.get("location"));
        assertEquals("beijing", query.get("adm"));
        assertEquals("cn", query.get("range"));
        assertEquals("2", query.get("number"));
    }

    @Test
    void absentOptionalArgumentsAreLeftOutOfQuery() {
        api.cityLookup("london", null, null, null);

        Map<String, String> query = stub.lastRequest().query();
        assertFalse(query.containsKey("adm"));
        assertFalse(query.containsKey("range"));
        assertFalse(query.containsKey("number"));
    }

    @Test
    void cityTopResolvesToTopCityList() {
        DataPayload payload = api.cityTop("world", 10).orElseThrow();

        DataPayload.TopCityList top = assertInstanceOf(DataPayload.TopCityList.class, payload);
        assertTrue(top.topCityList().get(0).isDst());
        assertEquals(-0.12574, top.topCityList().get(0).lon());
    }

    @Test
    void poiLookupAndRangeResolveToPoiList() {
        DataPayload lookup = api.poiLookup("景山", "scenic", "beijing", null).orElseThrow();
        DataPayload range = api.poiRange("116.40,39.88", "scenic", 5.0, 10).orElseThrow();

        assertEquals("景山公园", assertInstanceOf(DataPayload.PoiList.class, lookup).poi().get(0).name());
        assertInstanceOf(DataPayload.PoiList.class, range);
        assertEquals("5", stub.lastRequest().query().get("radius"));
        assertEquals("scenic", stub.lastRequest().query().get("type"));
    }

    @Test
    void outOfRangeArgumentsFailBeforeAnyRequest() {
        assertInstanceOf(ApiError.ValidationError.class, api.cityLookup("london", null, null, 21).error().orElseThrow());
        assertInstanceOf(ApiError.ValidationError.class, api.cityTop(null, 0).error().orElseThrow());
        assertInstanceOf(ApiError.ValidationError.class, api.poiLookup("x", "", null, null).error().orElseThrow());
        assertInstanceOf(ApiError.ValidationError.class, api.poiRange("116.40,39.88", "scenic", 51.0, null).error().orElseThrow());
        assertTrue(stub.requests().isEmpty());
    }
}
