package io.oauthbridge.javalin.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.javalin.http.Context;
import io.javalin.http.ExceptionHandler;
import io.oauthbridge.core.error.ErrorStatusPolicy;
import io.oauthbridge.core.error.WebException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a {@link WebException} that escaped a handler.
 *
 * <p>
 * The status comes from the {@link ErrorStatusPolicy}. Server errors are
 * logged at ERROR with the full exception and answered with a generic
 * problem body; client errors are logged at WARN and disclose the kind.
 */
public final class WebExceptionHandler implements ExceptionHandler<WebException> {

    private static final Logger LOG = LoggerFactory.getLogger(WebExceptionHandler.class);

    private final ErrorStatusPolicy policy;

    public WebExceptionHandler(ErrorStatusPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    @Override
    public void handle(WebException e, Context ctx) {
        int status = policy.statusFor(e);
        String path = ctx.path();
        JsonNode body;
        if (status >= 500) {
            LOG.error("OAuth request failed: path={}, kind={}, status={}", path, e.kind().id(), status, e);
            body = ProblemDetail.serverError(status, path);
        } else {
            LOG.warn("OAuth request rejected: path={}, kind={}, status={}: {}", path, e.kind().id(), status,
                    e.getMessage());
            body = ProblemDetail.clientError(e.kind(), status, path);
        }
        ctx.status(status);
        ctx.contentType(ProblemDetail.CONTENT_TYPE);
        ctx.result(body.toString());
    }

    public ErrorStatusPolicy policy() {
        return policy;
    }
}
