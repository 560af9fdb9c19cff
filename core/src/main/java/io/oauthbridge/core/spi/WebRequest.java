package io.oauthbridge.core.spi;

import io.oauthbridge.core.model.NormalizedParameter;

/**
 * Request capabilities the authorization engine consumes.
 *
 * <p>
 * The engine reads only the fields a protocol step needs. Implementations
 * must fail lazily: a field that could not be extracted raises its
 * {@link io.oauthbridge.core.error.WebException} when it is read, never
 * before, so a step that ignores the body never sees a body error.
 */
public interface WebRequest {

    /**
     * The parsed query string.
     *
     * @throws io.oauthbridge.core.error.WebException kind {@code QUERY} if the
     *         query was absent or unparseable
     */
    NormalizedParameter query();

    /**
     * The parsed {@code application/x-www-form-urlencoded} body.
     *
     * @throws io.oauthbridge.core.error.WebException kind {@code BODY} if the
     *         body was absent or not a form
     */
    NormalizedParameter urlBody();

    /**
     * The single {@code Authorization} header value.
     *
     * @return the header value, or {@code null} if the request carried none
     */
    String authHeader();
}
