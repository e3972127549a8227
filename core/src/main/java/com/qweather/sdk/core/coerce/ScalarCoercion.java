package com.qweather.sdk.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Single home of the provider's "string or number or empty" rule.
 *
 * <ul>
 *     <li>native JSON numbers and booleans convert directly</li>
 *     <li>strings are trimmed and parsed as the target type</li>
 *     <li>{@code null}, a missing node and an empty string mean "no value"</li>
 * </ul>
 *
 * <p>"No value" is {@link Optional#empty()} for optional fields and a {@link ScalarCoercionException}
 * for required ones. A non-empty string that does not parse is always an error.
 */
public final class ScalarCoercion {
    private ScalarCoercion() {
    }

    public static <T> Optional<T> optional(JsonNode node, ScalarType<T> type) {
        if (isAbsent(node) || isBlankText(node)) {
            return Optional.empty();
        }
        return Optional.of(convert(node, type));
    }

    public static <T> T required(JsonNode node, ScalarType<T> type) {
        if (isAbsent(node)) {
            throw new ScalarCoercionException(type, "null", "value is required");
        }
        if (isBlankText(node)) {
            throw new ScalarCoercionException(type, node.toString(), "value is required");
        }
        return convert(node, type);
    }

    private static <T> T convert(JsonNode node, ScalarType<T> type) {
        try {
            if (node.isNumber()) {
                return type.fromNumber(node.decimalValue());
            }
            if (node.isBoolean()) {
                return type.fromBoolean(node.booleanValue());
            }
            if (node.isTextual()) {
                return type.fromText(node.textValue().trim());
            }
        } catch (ArithmeticException | IllegalArgumentException e) {
            throw new ScalarCoercionException(type, node.toString(), e.getMessage() == null ? "unparsable" : e.getMessage());
        }
        throw new ScalarCoercionException(type, node.toString(), "unsupported JSON type " + node.getNodeType());
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static boolean isBlankText(JsonNode node) {
        return node.isTextual() && node.textValue().isBlank();
    }
}
