package io.oauthbridge.javalin.config;

import io.oauthbridge.core.error.ErrorStatusPolicy;
import io.oauthbridge.core.error.WebException;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the bridge.
 *
 * <p>
 * Every field has a default; use {@link #builder()} or {@link #defaults()}.
 *
 * @param mailboxCapacity messages that may wait for the endpoint worker
 *                        ({@code dispatch.mailbox-capacity})
 * @param timeoutMs       how long a handler waits for the worker's reply
 *                        ({@code dispatch.timeout-ms})
 * @param workerName      worker thread name ({@code dispatch.worker-name})
 * @param errorStatus     HTTP status per error kind
 *                        ({@code errors.status.<kind>})
 */
public record BridgeConfig(int mailboxCapacity, long timeoutMs, String workerName, ErrorStatusPolicy errorStatus) {

    public static final int DEFAULT_MAILBOX_CAPACITY = 64;
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;
    public static final String DEFAULT_WORKER_NAME = "oauth-endpoint";

    public BridgeConfig {
        if (mailboxCapacity < 1) {
            throw new IllegalArgumentException("mailbox-capacity must be at least 1, was " + mailboxCapacity);
        }
        if (timeoutMs < 1) {
            throw new IllegalArgumentException("timeout-ms must be positive, was " + timeoutMs);
        }
        if (workerName == null || workerName.isBlank()) {
            throw new IllegalArgumentException("worker-name must not be blank");
        }
        Objects.requireNonNull(errorStatus, "errorStatus must not be null");
    }

    public static BridgeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }

    /** Builder for {@link BridgeConfig}. */
    public static final class Builder {

        private int mailboxCapacity = DEFAULT_MAILBOX_CAPACITY;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private String workerName = DEFAULT_WORKER_NAME;
        private ErrorStatusPolicy errorStatus = ErrorStatusPolicy.failClosed();

        private Builder() {}

        public Builder mailboxCapacity(int mailboxCapacity) {
            this.mailboxCapacity = mailboxCapacity;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder workerName(String workerName) {
            this.workerName = workerName;
            return this;
        }

        public Builder errorStatus(ErrorStatusPolicy errorStatus) {
            this.errorStatus = errorStatus;
            return this;
        }

        /** Overrides the status of one kind on top of what was set so far. */
        public Builder errorStatus(WebException.Kind kind, int status) {
            this.errorStatus = errorStatus.withStatus(kind, status);
            return this;
        }

        public BridgeConfig build() {
            return new BridgeConfig(mailboxCapacity, timeoutMs, workerName, errorStatus);
        }
    }
}
