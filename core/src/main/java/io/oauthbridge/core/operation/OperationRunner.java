package io.oauthbridge.core.operation;

import io.oauthbridge.core.spi.Endpoint;
import io.oauthbridge.core.spi.WebRequest;
import io.oauthbridge.core.spi.WebResponse;
import java.util.Objects;

/**
 * Runs operations against an engine, either directly on the calling thread
 * ({@link #direct(Endpoint)}) or through an {@link EndpointWorker}.
 */
public interface OperationRunner<R extends WebRequest, S extends WebResponse> {

    /**
     * Runs {@code operation} and returns its result.
     *
     * @throws io.oauthbridge.core.error.WebException if the operation or its
     *         dispatch fails
     */
    <T> T execute(Operation<R, S, T> operation);

    /** Runner that calls the engine on the caller's thread. */
    static <R extends WebRequest, S extends WebResponse> OperationRunner<R, S> direct(Endpoint<R, S> endpoint) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        return new OperationRunner<>() {
            @Override
            public <T> T execute(Operation<R, S, T> operation) {
                return operation.run(endpoint);
            }
        };
    }
}
