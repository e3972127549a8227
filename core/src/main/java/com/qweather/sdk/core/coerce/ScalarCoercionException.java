package com.qweather.sdk.core.coerce;

public class ScalarCoercionException extends IllegalArgumentException {
    private final String targetType;
    private final String rawValue;

    public ScalarCoercionException(ScalarType<?> targetType, String rawValue, String reason) {
        super("Cannot coerce " + rawValue + " to " + targetType.name() + ": " + reason);
        this.targetType = targetType.name();
        this.rawValue = rawValue;
    }

    public String targetType() {
        return targetType;
    }

    public String rawValue() {
        return rawValue;
    }
}
