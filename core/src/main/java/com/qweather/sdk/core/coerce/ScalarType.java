package com.qweather.sdk.core.coerce;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.function.Function;

/**
 * Target scalar of a tolerant field decode. Every numeric target parses through {@link BigDecimal},
 * so {@code "37"}, {@code 37} and {@code 37.0} land on the same value; integral targets reject
 * values with a fractional part.
 */
public final class ScalarType<T> {
    public static final ScalarType<Integer> INTEGER = numeric("integer", value -> integral(value).intValueExact());
    public static final ScalarType<Long> LONG = numeric("long", value -> integral(value).longValueExact());
    public static final ScalarType<Float> FLOAT = numeric("float", BigDecimal::floatValue);
    public static final ScalarType<Double> DOUBLE = numeric("double", BigDecimal::doubleValue);
    public static final ScalarType<Boolean> BOOLEAN = new ScalarType<>(
            "boolean",
            ScalarType::booleanFromText,
            ScalarType::booleanFromNumber,
            Function.identity()
    );

    private final String name;
    private final Function<String, T> fromText;
    private final Function<BigDecimal, T> fromNumber;
    private final Function<Boolean, T> fromBoolean;

    private ScalarType(
            String name,
            Function<String, T> fromText,
            Function<BigDecimal, T> fromNumber,
            Function<Boolean, T> fromBoolean
    ) {
        this.name = name;
        this.fromText = fromText;
        this.fromNumber = fromNumber;
        this.fromBoolean = fromBoolean;
    }

    public String name() {
        return name;
    }

    T fromText(String text) {
        return fromText.apply(text);
    }

    T fromNumber(BigDecimal value) {
        return fromNumber.apply(value);
    }

    T fromBoolean(boolean value) {
        if (fromBoolean == null) {
            throw new IllegalArgumentException("boolean is not a valid " + name);
        }
        return fromBoolean.apply(value);
    }

    @Override
    public String toString() {
        return name;
    }

    private static <T> ScalarType<T> numeric(String name, Function<BigDecimal, T> fromNumber) {
        return new ScalarType<>(name, text -> fromNumber.apply(new BigDecimal(text)), fromNumber, null);
    }

    private static BigDecimal integral(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() > 0) {
            throw new ArithmeticException("fractional value " + value.toPlainString());
        }
        return stripped;
    }

    private static Boolean booleanFromText(String text) {
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "1", "true" -> Boolean.TRUE;
            case "0", "false" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("not a boolean: " + text);
        };
    }

    private static Boolean booleanFromNumber(BigDecimal value) {
        if (value.compareTo(BigDecimal.ONE) == 0) {
            return Boolean.TRUE;
        }
        if (value.compareTo(BigDecimal.ZERO) == 0) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("not a boolean: " + value.toPlainString());
    }
}
