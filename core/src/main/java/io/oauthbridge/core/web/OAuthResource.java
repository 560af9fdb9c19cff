package io.oauthbridge.core.web;

import io.oauthbridge.core.model.HttpHeaders;
import java.util.Objects;

/**
 * Header-only counterpart of {@link OAuthRequest} for guarding resources.
 *
 * <p>
 * Reads nothing but the {@code Authorization} header, so the handler keeps
 * the request body for its own use.
 */
public final class OAuthResource {

    private final String auth;

    private OAuthResource(String auth) {
        this.auth = auth;
    }

    /**
     * @throws io.oauthbridge.core.error.WebException kind
     *         {@code AUTHORIZATION} if more than one {@code Authorization}
     *         header is present
     */
    public static OAuthResource create(HttpHeaders headers) {
        Objects.requireNonNull(headers, "headers must not be null");
        return new OAuthResource(OAuthRequest.singleAuthorization(headers));
    }

    /** The {@code Authorization} header, or {@code null}. */
    public String authorizationHeader() {
        return auth;
    }

    /** Full request with query and body absent, for running a resource check. */
    public OAuthRequest toRequest() {
        return new OAuthRequest(auth, null, null);
    }
}
