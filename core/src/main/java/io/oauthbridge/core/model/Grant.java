package io.oauthbridge.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;

/**
 * Authorization granted to a client on behalf of a resource owner, as
 * reported by a successful resource check.
 *
 * @param ownerId     identifier of the resource owner
 * @param clientId    identifier of the client holding the token
 * @param scope       space-separated scope tokens
 * @param redirectUri redirect URI the grant was issued for, may be null
 * @param until       expiry instant
 */
public record Grant(String ownerId, String clientId, String scope, URI redirectUri, Instant until) {

    public Grant {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(clientId, "clientId must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(until, "until must not be null");
    }

    /** Whether the grant has expired at {@code now}. */
    public boolean isExpired(Instant now) {
        return !now.isBefore(until);
    }
}
