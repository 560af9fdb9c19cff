package io.oauthbridge.core.operation;

import io.oauthbridge.core.spi.Endpoint;
import io.oauthbridge.core.web.OAuthRequest;
import io.oauthbridge.core.web.OAuthResponse;
import java.util.Objects;

/**
 * Authorization request of the code grant.
 *
 * <p>
 * The engine reads the client's parameters from the query, asks its consent
 * policy, and answers with a redirect carrying either a code or an error.
 * A request with an absent query still reaches the engine; it is the engine
 * that reads {@link OAuthRequest#query()} and observes kind {@code QUERY}.
 */
public final class Authorize implements Operation<OAuthRequest, OAuthResponse, OAuthResponse> {

    private final OAuthRequest request;
    private final SingleUse once = new SingleUse("authorize");

    public Authorize(OAuthRequest request) {
        this.request = Objects.requireNonNull(request, "request must not be null");
    }

    @Override
    public OAuthResponse run(Endpoint<OAuthRequest, OAuthResponse> endpoint) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        return once.run(() -> endpoint.authorize(request));
    }

    public boolean isConsumed() {
        return once.isConsumed();
    }
}
