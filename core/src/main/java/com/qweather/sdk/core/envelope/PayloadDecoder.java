package com.qweather.sdk.core.envelope;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qweather.sdk.core.util.JsonUtils;

import java.io.IOException;

@FunctionalInterface
public interface PayloadDecoder<T> {
    T decode(ObjectNode body) throws IOException;

    static <T> PayloadDecoder<T> of(Class<T> type) {
        return body -> JsonUtils.objectMapper().treeToValue(body, type);
    }

    static <T> PayloadDecoder<T> of(TypeReference<T> type) {
        return body -> JsonUtils.objectMapper().readerFor(type).readValue(body);
    }
}
