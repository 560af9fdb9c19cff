package io.oauthbridge.core.web;

import io.oauthbridge.core.error.WebException;
import io.oauthbridge.core.model.HttpHeaders;
import io.oauthbridge.core.model.NormalizedParameter;
import io.oauthbridge.core.spi.ParameterExtractor;
import io.oauthbridge.core.spi.WebRequest;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalized request handed to the authorization engine.
 *
 * <p>
 * Holds the single {@code Authorization} header value and the parsed query
 * and form body. A query or body that could not be extracted is stored as
 * absent, which is not the same as present-but-empty: reading an absent
 * field through {@link #query()} or {@link #urlBody()} raises the matching
 * {@link WebException}, while a handler that never reads it never fails.
 *
 * <p>
 * Construction reads the request body. Use {@link OAuthResource} on handlers
 * that need the raw payload for themselves.
 */
public final class OAuthRequest implements WebRequest {

    private static final Logger LOG = LoggerFactory.getLogger(OAuthRequest.class);

    static final String AUTHORIZATION = "authorization";

    private final String auth;
    private final NormalizedParameter query;
    private final NormalizedParameter body;

    OAuthRequest(String auth, NormalizedParameter query, NormalizedParameter body) {
        this.auth = auth;
        this.query = query;
        this.body = body;
    }

    /**
     * Builds a request from the framework's raw data.
     *
     * <p>
     * The {@code Authorization} header is validated first; each extractor is
     * then invoked exactly once. Extraction failures are recorded as absent
     * fields.
     *
     * @param headers raw request headers
     * @param query   query-string parser
     * @param body    form-body parser (may block on I/O)
     * @throws WebException kind {@code AUTHORIZATION} if more than one
     *                      {@code Authorization} header is present
     */
    public static OAuthRequest create(HttpHeaders headers, ParameterExtractor query, ParameterExtractor body) {
        Objects.requireNonNull(headers, "headers must not be null");
        String auth = singleAuthorization(headers);
        return new OAuthRequest(auth, extract("query", query), extract("body", body));
    }

    /** Request carrying already-parsed fields; {@code null} marks a field absent. */
    public static OAuthRequest of(String auth, NormalizedParameter query, NormalizedParameter body) {
        return new OAuthRequest(auth, query, body);
    }

    static String singleAuthorization(HttpHeaders headers) {
        List<String> values = headers.all(AUTHORIZATION);
        if (values.size() > 1) {
            LOG.debug("Rejecting request with {} Authorization headers", values.size());
            throw WebException.authorization();
        }
        return values.isEmpty() ? null : values.get(0);
    }

    private static NormalizedParameter extract(String field, ParameterExtractor extractor) {
        if (extractor == null) {
            return null;
        }
        try {
            return extractor.extract();
        } catch (WebException e) {
            LOG.debug("Request {} unavailable ({}): {}", field, e.kind(), e.getMessage());
            return null;
        }
    }

    // ── Engine contract ──

    @Override
    public NormalizedParameter query() {
        if (query == null) {
            throw WebException.query();
        }
        return query;
    }

    @Override
    public NormalizedParameter urlBody() {
        if (body == null) {
            throw WebException.body();
        }
        return body;
    }

    @Override
    public String authHeader() {
        return auth;
    }

    // ── Plain accessors ──

    /** The {@code Authorization} header, or {@code null}. */
    public String authorizationHeader() {
        return auth;
    }

    /** The query, or {@code null} if absent. */
    public NormalizedParameter queryParameters() {
        return query;
    }

    /** The form body, or {@code null} if absent. */
    public NormalizedParameter bodyParameters() {
        return body;
    }

    public boolean hasQuery() {
        return query != null;
    }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public String toString() {
        return "OAuthRequest{auth=" + (auth != null ? "present" : "absent")
                + ", query=" + (query != null ? query.keys() : "absent")
                + ", body=" + (body != null ? body.keys() : "absent") + "}";
    }
}
