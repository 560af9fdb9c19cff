package io.oauthbridge.core.operation;

import io.oauthbridge.core.spi.Endpoint;
import io.oauthbridge.core.spi.WebRequest;
import io.oauthbridge.core.spi.WebResponse;

/**
 * One protocol step, bound to its parameters and waiting for an engine.
 *
 * <p>
 * An operation is single-use: {@link #run} consumes it, and running it again
 * is a programming error reported with {@link IllegalStateException}.
 * Whether it runs on the caller's thread or inside an
 * {@link EndpointWorker}, the contract is the same.
 *
 * @param <R> request type the engine consumes
 * @param <S> response type the engine produces
 * @param <T> result of the step
 */
public interface Operation<R extends WebRequest, S extends WebResponse, T> {

    /**
     * Executes the step against {@code endpoint}.
     *
     * @throws io.oauthbridge.core.error.WebException if the step fails; engine
     *         protocol errors arrive as kind {@code ENDPOINT}
     * @throws IllegalStateException if this operation has already run
     */
    T run(Endpoint<R, S> endpoint);

    /** Places this operation into an envelope for an {@link EndpointWorker}. */
    default OperationMessage<R, S, T> wrap() {
        return new OperationMessage<>(this);
    }
}
