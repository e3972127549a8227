package com.qweather.sdk.core.coerce;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.util.AccessPattern;

import java.io.IOException;

final class CoercingScalarDeserializer<T> extends StdDeserializer<T> {
    private final ScalarType<T> type;
    private final boolean required;

    CoercingScalarDeserializer(Class<T> handledType, ScalarType<T> type, boolean required) {
        super(handledType);
        this.type = type;
        this.required = required;
    }

    @Override
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = ctxt.readTree(p);
        try {
            if (required) {
                return ScalarCoercion.required(node, type);
            }
            return ScalarCoercion.optional(node, type).orElse(null);
        } catch (ScalarCoercionException e) {
            throw InvalidFormatException.from(p, e.getMessage(), node.toString(), handledType());
        }
    }

    @Override
    public T getNullValue(DeserializationContext ctxt) throws JsonMappingException {
        if (required) {
            return ctxt.reportInputMismatch(this, "Missing required %s value", type.name());
        }
        return null;
    }

    @Override
    public AccessPattern getNullAccessPattern() {
        return required ? AccessPattern.DYNAMIC : AccessPattern.ALWAYS_NULL;
    }
}
