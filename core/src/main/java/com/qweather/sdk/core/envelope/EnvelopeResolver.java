package com.qweather.sdk.core.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qweather.sdk.core.util.JsonUtils;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns one raw HTTP response into an {@link ApiResponse}. A body is either wholly a success or
 * wholly an error; decode problems come back as {@link ApiError.DecodeError} values, never as
 * exceptions.
 */
public final class EnvelopeResolver {
    public static final String STATUS_FIELD = "code";
    public static final String SUCCESS_CODE = "200";
    static final String UPDATE_TIME_FIELD = "updateTime";
    static final String FX_LINK_FIELD = "fxLink";
    static final String REFER_FIELD = "refer";
    private static final List<String> ENVELOPE_FIELDS = List.of(STATUS_FIELD, UPDATE_TIME_FIELD, FX_LINK_FIELD, REFER_FIELD);
    private static final Logger LOGGER = Logger.getLogger(EnvelopeResolver.class.getName());

    private final ObjectMapper mapper;

    public EnvelopeResolver() {
        this(JsonUtils.objectMapper());
    }

    public EnvelopeResolver(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public <T> ApiResponse<T> resolve(int httpStatus, String body, PayloadDecoder<T> decoder) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            LOGGER.log(Level.WARNING, "Response body is not JSON (HTTP " + httpStatus + ")", e);
            return ApiResponse.failure(new ApiError.TransportError(
                    "Response body is not valid JSON (HTTP " + httpStatus + "): " + e.getOriginalMessage()
            ));
        }
        if (root == null || root.isMissingNode()) {
            return ApiResponse.failure(new ApiError.TransportError("Empty response body (HTTP " + httpStatus + ")"));
        }
        if (!root.isObject()) {
            return decodeFailure("Expected a JSON object but got " + root.getNodeType(), null);
        }
        return resolve(httpStatus, (ObjectNode) root, decoder);
    }

    public <T> ApiResponse<T> resolve(int httpStatus, ObjectNode root, PayloadDecoder<T> decoder) {
        String code = statusCode(root);
        if (code == null && httpStatus / 100 != 2) {
            return ApiResponse.failure(new ApiError.ProviderError(String.valueOf(httpStatus)));
        }
        if (code != null && !SUCCESS_CODE.equals(code)) {
            return ApiResponse.failure(new ApiError.ProviderError(code));
        }

        try {
            OffsetDateTime updateTime = readOptional(root, UPDATE_TIME_FIELD, OffsetDateTime.class);
            String fxLink = readOptional(root, FX_LINK_FIELD, String.class);
            Refer refer = readOptional(root, REFER_FIELD, Refer.class);
            ObjectNode payloadBody = root.deepCopy();
            payloadBody.remove(ENVELOPE_FIELDS);
            T payload = decoder.decode(payloadBody);
            if (payload == null) {
                return decodeFailure("Payload decoded to null", null);
            }
            return ApiResponse.success(new Envelope<>(code, updateTime, fxLink, refer, payload));
        } catch (IOException | IllegalArgumentException e) {
            return decodeFailure("Failed to parse response: " + e.getMessage(), e);
        }
    }

    static String statusCode(ObjectNode root) {
        JsonNode status = root.get(STATUS_FIELD);
        if (status == null || status.isNull()) {
            return null;
        }
        if (status.isTextual() || status.isNumber()) {
            return status.asText();
        }
        return status.toString();
    }

    private <V> V readOptional(ObjectNode root, String field, Class<V> type) throws IOException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return mapper.treeToValue(node, type);
    }

    private static <T> ApiResponse<T> decodeFailure(String message, Exception cause) {
        LOGGER.log(Level.WARNING, message, cause);
        return ApiResponse.failure(new ApiError.DecodeError(message));
    }
}
