package io.oauthbridge.core.operation;

import io.oauthbridge.core.spi.Endpoint;
import io.oauthbridge.core.web.OAuthRequest;
import io.oauthbridge.core.web.OAuthResponse;
import java.util.Objects;

/** Access token refresh using a refresh token. */
public final class Refresh implements Operation<OAuthRequest, OAuthResponse, OAuthResponse> {

    private final OAuthRequest request;
    private final SingleUse once = new SingleUse("refresh");

    public Refresh(OAuthRequest request) {
        this.request = Objects.requireNonNull(request, "request must not be null");
    }

    @Override
    public OAuthResponse run(Endpoint<OAuthRequest, OAuthResponse> endpoint) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        return once.run(() -> endpoint.refresh(request));
    }

    public boolean isConsumed() {
        return once.isConsumed();
    }
}
