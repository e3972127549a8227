package com.qweather.sdk.core.coerce;

import com.fasterxml.jackson.databind.module.SimpleModule;

import java.time.OffsetDateTime;

/**
 * Binds {@link ScalarCoercion} to every numeric and boolean target. Primitive record components
 * ({@code double}, {@code int}, ...) are required; boxed ones ({@code Double}, {@code Integer}, ...)
 * are optional and read as {@code null} when the provider sends nothing.
 */
public final class CoercionModule extends SimpleModule {
    public CoercionModule() {
        super("QWeatherCoercionModule");
        bind(Integer.class, int.class, ScalarType.INTEGER);
        bind(Long.class, long.class, ScalarType.LONG);
        bind(Float.class, float.class, ScalarType.FLOAT);
        bind(Double.class, double.class, ScalarType.DOUBLE);
        bind(Boolean.class, boolean.class, ScalarType.BOOLEAN);
        addDeserializer(OffsetDateTime.class, new ProviderDateTimeDeserializer());
    }

    private <T> void bind(Class<T> boxed, Class<T> primitive, ScalarType<T> type) {
        addDeserializer(boxed, new CoercingScalarDeserializer<>(boxed, type, false));
        addDeserializer(primitive, new CoercingScalarDeserializer<>(primitive, type, true));
    }
}
