package io.oauthbridge.core.spi;

import io.oauthbridge.core.model.NormalizedParameter;

/**
 * Framework-provided parser for one request field (query string or form
 * body).
 *
 * <p>
 * Invoked at most once per request. A body extractor may block on reading
 * the payload.
 */
@FunctionalInterface
public interface ParameterExtractor {

    /** Extractor for a field the request does not have. */
    ParameterExtractor ABSENT = () -> null;

    /**
     * Parses the field.
     *
     * @return the parameters, or {@code null} if the field is not present
     * @throws io.oauthbridge.core.error.WebException if the field cannot be
     *         parsed
     */
    NormalizedParameter extract();
}
