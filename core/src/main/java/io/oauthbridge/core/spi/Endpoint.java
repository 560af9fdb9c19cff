package io.oauthbridge.core.spi;

import io.oauthbridge.core.model.ResourceOutcome;

/**
 * The authorization engine, as seen from the adapter.
 *
 * <p>
 * An implementation owns client registration, consent, token issuance and
 * validation; the adapter only hands it requests and renders what it
 * returns. Protocol failures are reported with
 * {@link io.oauthbridge.core.error.OAuthException}. Failures of the request
 * or response capabilities propagate as
 * {@link io.oauthbridge.core.error.WebException} unchanged.
 *
 * <p>
 * Implementations hold long-lived mutable state (token store, client
 * registry). They are either confined to one
 * {@link io.oauthbridge.core.operation.EndpointWorker} or must be thread-safe
 * themselves.
 *
 * @param <R> request type
 * @param <S> response type
 */
public interface Endpoint<R extends WebRequest, S extends WebResponse> {

    /** Authorization request: consent, then redirect with a code or an error. */
    S authorize(R request);

    /** Access token request with an authorization code. */
    S token(R request);

    /** Access token refresh with a refresh token. */
    S refresh(R request);

    /** Bearer token check guarding a protected resource. */
    ResourceOutcome<S> resource(R request);
}
