package io.oauthbridge.core.error;

import io.oauthbridge.core.model.OAuthError;
import java.util.Objects;

/**
 * Raised by an {@link io.oauthbridge.core.spi.Endpoint} when a protocol step
 * fails. Operations convert it into {@link WebException} with kind
 * {@link WebException.Kind#ENDPOINT}; it never crosses the adapter boundary
 * on its own.
 */
public class OAuthException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final OAuthError error;

    public OAuthException(OAuthError error) {
        super(Objects.requireNonNull(error, "error must not be null").description());
        this.error = error;
    }

    public OAuthException(OAuthError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error must not be null").description(), cause);
        this.error = error;
    }

    /** The protocol error reported by the engine. */
    public OAuthError error() {
        return error;
    }
}
