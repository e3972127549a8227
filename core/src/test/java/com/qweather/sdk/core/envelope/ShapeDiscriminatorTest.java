package com.qweather.sdk.core.envelope;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qweather.sdk.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShapeDiscriminatorTest {
    private final ShapeDiscriminator<Shape> discriminator = ShapeDiscriminator.<Shape>builder("Shape")
            .variant("Daily", Daily.class, "daily")
            .variant("Hourly", Hourly.class, "hourly")
            .variant("Poi", Poi.class, "poi")
            .build();

    @Test
    void selectsVariantByPresentField() throws Exception {
        Shape daily = discriminator.decode(body("{\"daily\":[{\"tempMax\":\"30\"}]}"));
        Shape poi = discriminator.decode(body("{\"poi\":[{\"name\":\"Park\"}]}"));

        Daily decoded = assertInstanceOf(Daily.class, daily);
        assertEquals(30, decoded.daily().get(0).tempMax());
        assertInstanceOf(Poi.class, poi);
    }

    @Test
    void noMatchingVariantFailsWithTriedVariants() {
        ShapeMismatchException error = assertThrows(
                ShapeMismatchException.class,
                () -> discriminator.decode(body("{\"now\":{}}"))
        );

        assertEquals(List.of("Daily", "Hourly", "Poi"), error.triedVariants());
        assertTrue(error.getMessage().contains("now"));
    }

    @Test
    void nullFieldDoesNotCountAsPresent() {
        assertThrows(ShapeMismatchException.class, () -> discriminator.select(body("{\"daily\":null}")));
    }

    @Test
    void firstDeclaredVariantWinsWhenBodyMatchesSeveral() throws Exception {
        Shape shape = discriminator.decode(body("{\"hourly\":[],\"daily\":[]}"));

        assertInstanceOf(Daily.class, shape);
    }

    @Test
    void overlappingVariantsAreRejected() {
        ShapeDiscriminator.Builder<Shape> builder = ShapeDiscriminator.<Shape>builder("Overlap")
                .variant("Daily", Daily.class, "daily")
                .variant("DailyWithPoi", Poi.class, "daily", "poi");

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void duplicateNamesAndEmptyListsAreRejected() {
        assertThrows(IllegalStateException.class, () -> ShapeDiscriminator.<Shape>builder("Empty").build());
        assertThrows(IllegalStateException.class, () -> ShapeDiscriminator.<Shape>builder("Dup")
                .variant("Same", Daily.class, "daily")
                .variant("Same", Poi.class, "poi")
                .build());
        assertThrows(IllegalArgumentException.class, () -> ShapeDiscriminator.<Shape>builder("NoFields")
                .variant("Daily", Daily.class));
    }

    @Test
    void resolverTurnsMismatchIntoDecodeError() {
        ApiResponse<Shape> response = new EnvelopeResolver().resolve(200, "{\"code\":\"200\",\"now\":{}}", discriminator);

        assertInstanceOf(ApiError.DecodeError.class, response.error().orElseThrow());
    }

    private static ObjectNode body(String json) throws Exception {
        return (ObjectNode) JsonUtils.objectMapper().readTree(json);
    }

    sealed interface Shape permits Daily, Hourly, Poi {
    }

    record Day(int tempMax) {
    }

    record Daily(List<Day> daily) implements Shape {
    }

    record Hourly(List<Object> hourly) implements Shape {
    }

    record Poi(List<Object> poi) implements Shape {
    }
}
