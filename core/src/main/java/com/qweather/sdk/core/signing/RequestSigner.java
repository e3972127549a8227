package com.qweather.sdk.core.signing;

import com.qweather.sdk.core.util.HashingUtils;

import java.util.Map;
import java.util.Objects;

/**
 * Computes {@code hex(digest(canonical + secret))}. The provider specifies MD5; any
 * {@link java.security.MessageDigest} algorithm name can be supplied instead.
 */
public final class RequestSigner {
    public static final String DEFAULT_ALGORITHM = "MD5";

    private final String secret;
    private final String algorithm;

    public RequestSigner(String secret) {
        this(secret, DEFAULT_ALGORITHM);
    }

    public RequestSigner(String secret, String algorithm) {
        this.secret = Objects.requireNonNull(secret, "secret is required");
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm is required");
        // rejects unknown algorithm names up front
        HashingUtils.newDigest(algorithm);
    }

    public String algorithm() {
        return algorithm;
    }

    public String sign(Map<String, String> params) {
        return HashingUtils.hexDigest(algorithm, ParamCanonicalizer.canonicalize(params) + secret);
    }

    public Map<String, String> signInto(Map<String, String> params) {
        params.put(ParamCanonicalizer.SIGNATURE_KEY, sign(params));
        return params;
    }
}
