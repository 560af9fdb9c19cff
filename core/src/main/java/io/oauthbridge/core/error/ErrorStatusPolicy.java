package io.oauthbridge.core.error;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps {@link WebException.Kind}s to HTTP status codes.
 *
 * <p>
 * The default policy answers 500 for every kind: the adapter cannot know
 * which internal failures are safe to disclose, so it fails closed. Callers
 * opt individual kinds into other statuses with {@link #withStatus}.
 *
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class ErrorStatusPolicy {

    public static final int DEFAULT_STATUS = 500;

    private static final ErrorStatusPolicy FAIL_CLOSED =
            new ErrorStatusPolicy(new EnumMap<>(WebException.Kind.class));

    private final EnumMap<WebException.Kind, Integer> overrides;

    private ErrorStatusPolicy(EnumMap<WebException.Kind, Integer> overrides) {
        this.overrides = overrides;
    }

    /** Every kind maps to {@value #DEFAULT_STATUS}. */
    public static ErrorStatusPolicy failClosed() {
        return FAIL_CLOSED;
    }

    /**
     * Creates a policy from a per-kind override map.
     *
     * @throws IllegalArgumentException if any status is outside 400..599
     */
    public static ErrorStatusPolicy of(Map<WebException.Kind, Integer> overrides) {
        ErrorStatusPolicy policy = FAIL_CLOSED;
        for (Map.Entry<WebException.Kind, Integer> entry : overrides.entrySet()) {
            policy = policy.withStatus(entry.getKey(), entry.getValue());
        }
        return policy;
    }

    /**
     * Returns a copy of this policy answering {@code status} for {@code kind}.
     *
     * @throws IllegalArgumentException if {@code status} is not an error status
     *                                  (400..599)
     */
    public ErrorStatusPolicy withStatus(WebException.Kind kind, int status) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (status < 400 || status > 599) {
            throw new IllegalArgumentException("Status for " + kind.id() + " must be within 400..599, was " + status);
        }
        EnumMap<WebException.Kind, Integer> copy = new EnumMap<>(WebException.Kind.class);
        copy.putAll(overrides);
        copy.put(kind, status);
        return new ErrorStatusPolicy(copy);
    }

    public int statusFor(WebException.Kind kind) {
        return overrides.getOrDefault(kind, DEFAULT_STATUS);
    }

    public int statusFor(WebException e) {
        return statusFor(e.kind());
    }

    /** The explicit overrides, without defaulted kinds. */
    public Map<WebException.Kind, Integer> overrides() {
        return Collections.unmodifiableMap(overrides);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ErrorStatusPolicy that)) return false;
        return overrides.equals(that.overrides);
    }

    @Override
    public int hashCode() {
        return overrides.hashCode();
    }

    @Override
    public String toString() {
        return "ErrorStatusPolicy" + overrides;
    }
}
