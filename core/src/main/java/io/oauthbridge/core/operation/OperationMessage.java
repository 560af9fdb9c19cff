package io.oauthbridge.core.operation;

import io.oauthbridge.core.spi.WebRequest;
import io.oauthbridge.core.spi.WebResponse;
import java.util.Objects;

/**
 * Envelope carrying an {@link Operation} to an {@link EndpointWorker}.
 * Unwrapping returns the very same operation.
 */
public final class OperationMessage<R extends WebRequest, S extends WebResponse, T> {

    private final Operation<R, S, T> operation;

    OperationMessage(Operation<R, S, T> operation) {
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
    }

    public Operation<R, S, T> intoInner() {
        return operation;
    }

    @Override
    public String toString() {
        return "OperationMessage[" + operation.getClass().getSimpleName() + "]";
    }
}
