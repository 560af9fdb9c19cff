package io.oauthbridge.core.operation;

import io.oauthbridge.core.model.ResourceOutcome;
import io.oauthbridge.core.spi.Endpoint;
import io.oauthbridge.core.web.OAuthRequest;
import io.oauthbridge.core.web.OAuthResource;
import io.oauthbridge.core.web.OAuthResponse;
import java.util.Objects;

/**
 * Bearer token check for a protected resource.
 *
 * <p>
 * A denied check is not an error: the engine's prepared response comes back
 * inside the {@link ResourceOutcome}.
 */
public final class Resource implements Operation<OAuthRequest, OAuthResponse, ResourceOutcome<OAuthResponse>> {

    private final OAuthRequest request;
    private final SingleUse once = new SingleUse("resource");

    public Resource(OAuthRequest request) {
        this.request = Objects.requireNonNull(request, "request must not be null");
    }

    public Resource(OAuthResource resource) {
        this(resource.toRequest());
    }

    @Override
    public ResourceOutcome<OAuthResponse> run(Endpoint<OAuthRequest, OAuthResponse> endpoint) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        return once.run(() -> endpoint.resource(request));
    }

    public boolean isConsumed() {
        return once.isConsumed();
    }
}
