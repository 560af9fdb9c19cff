package io.oauthbridge.javalin.adapter;

import io.javalin.http.Context;
import io.oauthbridge.core.error.WebException;
import io.oauthbridge.core.model.HttpHeaders;
import io.oauthbridge.core.model.NormalizedParameter;
import io.oauthbridge.core.web.OAuthRequest;
import io.oauthbridge.core.web.OAuthResource;
import io.oauthbridge.core.web.OAuthResponse;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges Javalin's {@link Context} and the framework-neutral request and
 * response types of the core module.
 *
 * <p>
 * Header names are normalized to lowercase and every value of a repeated
 * header is kept, so a request carrying two {@code Authorization} headers is
 * seen as such. The query comes from {@link Context#queryParamMap()}; the
 * body is read through {@link Context#formParamMap()} only when the request
 * declares {@value #FORM_URLENCODED}. Any failure reading or decoding that
 * body leaves it absent; only a flow that reads it fails.
 *
 * <p>
 * This class is thread-safe: all state is local to each method invocation.
 */
public final class JavalinAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(JavalinAdapter.class);

    static final String FORM_URLENCODED = "application/x-www-form-urlencoded";

    /**
     * Wraps a request for the authorization, token and refresh flows. Reads
     * the request body if it is a form.
     *
     * @throws WebException kind {@code AUTHORIZATION} on repeated
     *                      {@code Authorization} headers
     */
    public OAuthRequest wrapRequest(Context ctx) {
        HttpHeaders headers = buildHeaders(ctx);
        OAuthRequest request = OAuthRequest.create(headers, () -> extractQuery(ctx), () -> extractForm(ctx));

        LOG.debug("wrapRequest: {} {} → {}", ctx.method(), ctx.path(), request);
        return request;
    }

    /**
     * Wraps a request for a resource check. Neither the query nor the body
     * is read.
     */
    public OAuthResource wrapResource(Context ctx) {
        OAuthResource resource = OAuthResource.create(buildHeaders(ctx));

        LOG.debug(
                "wrapResource: {} {} (authorization={})",
                ctx.method(),
                ctx.path(),
                resource.authorizationHeader() != null ? "present" : "absent");
        return resource;
    }

    /** Writes status, headers and body of {@code response} into {@code ctx}. */
    public void applyResponse(OAuthResponse response, Context ctx) {
        ctx.status(response.status());
        response.headers().forEach(ctx::header);
        String body = response.hasBody() ? response.body() : "";
        ctx.result(body);

        LOG.debug(
                "applyResponse: status={}, headers={}, body={} chars",
                response.status(),
                response.headers().keySet(),
                body.length());
    }

    static NormalizedParameter extractQuery(Context ctx) {
        try {
            return NormalizedParameter.ofMulti(ctx.queryParamMap());
        } catch (IllegalArgumentException e) {
            throw WebException.query(e);
        }
    }

    static NormalizedParameter extractForm(Context ctx) {
        if (!isForm(ctx.contentType())) {
            throw WebException.form();
        }
        try {
            return NormalizedParameter.ofMulti(ctx.formParamMap());
        } catch (Exception e) {
            // oversized payloads, broken streams (rethrown unchecked by Javalin) and bad escapes
            throw WebException.encoding(e);
        }
    }

    /** {@code true} for {@value #FORM_URLENCODED}, ignoring parameters such as charset. */
    static boolean isForm(String contentType) {
        if (contentType == null) {
            return false;
        }
        int semicolon = contentType.indexOf(';');
        String mediaType = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        return FORM_URLENCODED.equals(mediaType.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Builds an {@link HttpHeaders} from the servlet request's multi-value
     * headers with lowercase key normalization.
     */
    static HttpHeaders buildHeaders(Context ctx) {
        Map<String, List<String>> headersAll = new LinkedHashMap<>();
        var headerNames = ctx.req().getHeaderNames();
        if (headerNames != null) {
            while (headerNames.hasMoreElements()) {
                String name = headerNames.nextElement();
                var values = ctx.req().getHeaders(name);
                List<String> valueList = new ArrayList<>();
                if (values != null) {
                    while (values.hasMoreElements()) {
                        valueList.add(values.nextElement());
                    }
                }
                headersAll
                        .computeIfAbsent(name.toLowerCase(Locale.ROOT), k -> new ArrayList<>())
                        .addAll(valueList);
            }
        }
        headersAll.replaceAll((name, values) -> Collections.unmodifiableList(values));
        return HttpHeaders.ofMulti(headersAll);
    }
}
