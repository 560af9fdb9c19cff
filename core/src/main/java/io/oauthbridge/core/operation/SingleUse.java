package io.oauthbridge.core.operation;

import io.oauthbridge.core.error.OAuthException;
import io.oauthbridge.core.error.WebException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/** Consumption flag shared by the built-in operations. */
final class SingleUse {

    private final String name;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    SingleUse(String name) {
        this.name = name;
    }

    /**
     * Runs {@code step} once, converting engine protocol errors.
     *
     * @throws IllegalStateException on a second call
     */
    <T> T run(Supplier<T> step) {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException(name + " operation has already been run");
        }
        try {
            return step.get();
        } catch (OAuthException e) {
            throw WebException.from(e);
        }
    }

    boolean isConsumed() {
        return consumed.get();
    }
}
