package io.oauthbridge.javalin.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.HttpStatus;
import io.oauthbridge.core.error.WebException;

/**
 * Builds RFC 9457 Problem Details bodies for adapter errors.
 *
 * <p>
 * Two shapes exist. Server errors are generic and never reveal which kind
 * failed:
 * <pre>{@code
 * {
 * "type": "urn:oauth-bridge:error:internal",
 * "title": "Internal Server Error",
 * "status": 500,
 * "detail": "The request could not be processed",
 * "instance": "/oauth/token"
 * }
 * }</pre>
 * Client errors name the kind and its fixed description, nothing more.
 */
public final class ProblemDetail {

    public static final String CONTENT_TYPE = "application/problem+json";

    static final String URN_INTERNAL_ERROR = WebException.URN_PREFIX + "internal";
    static final String INTERNAL_DETAIL = "The request could not be processed";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProblemDetail() {
        // utility class
    }

    /**
     * Generic server error.
     *
     * @param status       a 5xx status
     * @param instancePath the request path (may be null)
     */
    public static JsonNode serverError(int status, String instancePath) {
        return build(URN_INTERNAL_ERROR, title(status), status, INTERNAL_DETAIL, instancePath);
    }

    /**
     * Client error disclosing {@code kind}.
     *
     * @param kind         the failed kind
     * @param status       a 4xx status
     * @param instancePath the request path (may be null)
     */
    public static JsonNode clientError(WebException.Kind kind, int status, String instancePath) {
        return build(kind.urn(), title(status), status, kind.description(), instancePath);
    }

    private static String title(int status) {
        HttpStatus httpStatus = HttpStatus.forStatus(status);
        return httpStatus != HttpStatus.UNKNOWN ? httpStatus.getMessage() : "Error";
    }

    static JsonNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
