package io.oauthbridge.core.web;

import io.oauthbridge.core.error.InvalidHeaderValueException;
import io.oauthbridge.core.error.WebException;
import io.oauthbridge.core.spi.WebResponse;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Response builder the engine drives through {@link WebResponse}.
 *
 * <p>
 * Starts as {@code 200} with no headers and no body. Each action sets the
 * status (where it has one) and replaces only the header it owns; headers set
 * by earlier actions stay. A failing action leaves the response untouched.
 *
 * <p>
 * Header names keep their canonical spelling and are matched
 * case-insensitively. Not thread-safe: a response belongs to one call path.
 */
public final class OAuthResponse implements WebResponse {

    public static final String LOCATION = "Location";
    public static final String WWW_AUTHENTICATE = "WWW-Authenticate";
    public static final String CONTENT_TYPE = "Content-Type";

    static final String TEXT_PLAIN = "text/plain";
    static final String APPLICATION_JSON = "application/json";

    private int status = 200;
    /** Lowercase name → (canonical name, value). */
    private final LinkedHashMap<String, Map.Entry<String, String>> headers = new LinkedHashMap<>();
    private String body;

    public OAuthResponse() {}

    // ── Engine contract ──

    @Override
    public void ok() {
        status = 200;
    }

    /** Redirect to {@code url}, written in its percent-encoded ASCII form. */
    @Override
    public void redirect(URI url) {
        Objects.requireNonNull(url, "url must not be null");
        redirect(url.toASCIIString());
    }

    /**
     * Redirect to a URL given in string form.
     *
     * @throws WebException kind {@code HEADER} if {@code url} is not a valid
     *                      header value; status and headers are unchanged
     */
    public void redirect(String url) {
        String location = headerValue(LOCATION, url);
        status = 302;
        putHeader(LOCATION, location);
    }

    @Override
    public void clientError() {
        status = 400;
    }

    @Override
    public void unauthorized(String kind) {
        String challenge = headerValue(WWW_AUTHENTICATE, kind);
        status = 401;
        putHeader(WWW_AUTHENTICATE, challenge);
    }

    @Override
    public void bodyText(String text) {
        body = Objects.requireNonNull(text, "text must not be null");
        putHeader(CONTENT_TYPE, TEXT_PLAIN);
    }

    @Override
    public void bodyJson(String json) {
        body = Objects.requireNonNull(json, "json must not be null");
        putHeader(CONTENT_TYPE, APPLICATION_JSON);
    }

    // ── Builder helpers ──

    /**
     * Sets {@code Content-Type}.
     *
     * @throws WebException kind {@code HEADER} if the value is invalid
     */
    public OAuthResponse withContentType(String contentType) {
        putHeader(CONTENT_TYPE, headerValue(CONTENT_TYPE, contentType));
        return this;
    }

    public OAuthResponse withBody(String body) {
        this.body = body;
        return this;
    }

    // ── Finalization view ──

    public int status() {
        return status;
    }

    /**
     * Header value by name (case-insensitive).
     *
     * @return the value, or {@code null} if not set
     */
    public String header(String name) {
        Map.Entry<String, String> entry = headers.get(name.toLowerCase(Locale.ROOT));
        return entry != null ? entry.getValue() : null;
    }

    /** Canonical name → value, in the order the headers were first set. */
    public Map<String, String> headers() {
        Map<String, String> view = new LinkedHashMap<>();
        headers.values().forEach(entry -> view.put(entry.getKey(), entry.getValue()));
        return Collections.unmodifiableMap(view);
    }

    /** The body, or {@code null} if none was set. */
    public String body() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    private void putHeader(String name, String value) {
        headers.put(name.toLowerCase(Locale.ROOT), Map.entry(name, value));
    }

    private static String headerValue(String name, String value) {
        try {
            return HeaderValues.validate(name, value);
        } catch (InvalidHeaderValueException e) {
            throw WebException.from(e);
        }
    }

    @Override
    public String toString() {
        return "OAuthResponse{status=" + status + ", headers=" + headers().keySet() + ", body="
                + (body != null ? body.length() + " chars" : "none") + "}";
    }
}
