package io.oauthbridge.core.model;

/**
 * Protocol-level failure vocabulary of the authorization engine.
 *
 * <p>
 * The engine decides which of these applies; this layer never reinterprets
 * them and only carries them into a {@link io.oauthbridge.core.error.WebException}.
 */
public enum OAuthError {

    /** The request is rejected and the client must not receive an error response. */
    DENY_SILENTLY("OAuth request failed silently"),

    /** An engine primitive (registrar, authorizer, issuer) failed internally. */
    PRIMITIVE_ERROR("A primitive of the OAuth engine failed"),

    /** The request was malformed beyond what the protocol can answer. */
    BAD_REQUEST("The request was malformed");

    private final String description;

    OAuthError(String description) {
        this.description = description;
    }

    /** Fixed human-readable description. */
    public String description() {
        return description;
    }
}
