package io.oauthbridge.core.spi;

import java.net.URI;

/**
 * Response actions the authorization engine dictates.
 *
 * <p>
 * Each action owns the status code and at most one header group. Actions
 * that build a header value throw
 * {@link io.oauthbridge.core.error.WebException} of kind {@code HEADER} when
 * the value cannot be sent; the response is left as it was.
 */
public interface WebResponse {

    /** Status 200. */
    void ok();

    /** Status 302 with {@code Location} set to the URL's string form. */
    void redirect(URI url);

    /** Status 400. */
    void clientError();

    /** Status 401 with {@code WWW-Authenticate} set to {@code kind}. */
    void unauthorized(String kind);

    /** Plain-text body; {@code Content-Type: text/plain}. */
    void bodyText(String text);

    /** JSON body, already serialized; {@code Content-Type: application/json}. */
    void bodyJson(String json);
}
