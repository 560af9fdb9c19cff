package io.oauthbridge.core.operation;

import io.oauthbridge.core.error.WebException;
import io.oauthbridge.core.spi.Endpoint;
import io.oauthbridge.core.spi.WebRequest;
import io.oauthbridge.core.spi.WebResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-consumer worker that owns a long-lived engine.
 *
 * <p>
 * Operations arrive as {@link OperationMessage}s in a bounded mailbox and are
 * run one at a time on the worker thread, in submission order. The engine is
 * only ever touched by that thread, so it needs no synchronization of its own.
 *
 * <p>
 * Submission never blocks: a full mailbox, or a worker that has been closed,
 * fails the reply immediately with kind {@code MAILBOX}. {@link #ask} waits
 * for the reply at most the configured timeout and reports a timeout or an
 * interrupted wait as kind {@code CANCELED}.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>constructor: starts accepting messages</li>
 * <li>{@link #close()}: rejects new messages, finishes queued ones</li>
 * </ol>
 */
public final class EndpointWorker<R extends WebRequest, S extends WebResponse>
        implements OperationRunner<R, S>, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointWorker.class);

    private final Endpoint<R, S> endpoint;
    private final String name;
    private final int mailboxCapacity;
    private final Duration timeout;
    private final ThreadPoolExecutor executor;

    /**
     * Creates and starts a worker.
     *
     * @param endpoint        the engine this worker owns exclusively
     * @param name            thread name
     * @param mailboxCapacity number of messages that may wait behind the one
     *                        being processed (at least 1)
     * @param timeout         how long {@link #ask} waits for a reply
     */
    public EndpointWorker(Endpoint<R, S> endpoint, String name, int mailboxCapacity, Duration timeout) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (mailboxCapacity < 1) {
            throw new IllegalArgumentException("mailboxCapacity must be at least 1, was " + mailboxCapacity);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, was " + timeout);
        }
        this.mailboxCapacity = mailboxCapacity;
        this.executor = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(mailboxCapacity),
                r -> {
                    Thread t = new Thread(r, name);
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        LOG.info("EndpointWorker started: name={}, mailboxCapacity={}, timeout={}ms", name, mailboxCapacity,
                timeout.toMillis());
    }

    /**
     * Queues {@code message} and returns its pending reply.
     *
     * <p>
     * The future completes exactly once: with the operation's result, with
     * the {@link WebException} it raised, or with kind {@code MAILBOX} if the
     * message was not accepted. A reply that is cancelled before the worker
     * reaches it is skipped.
     */
    public <T> CompletableFuture<T> send(OperationMessage<R, S, T> message) {
        Objects.requireNonNull(message, "message must not be null");
        CompletableFuture<T> reply = new CompletableFuture<>();
        try {
            executor.execute(() -> process(message, reply));
        } catch (RejectedExecutionException e) {
            LOG.warn("EndpointWorker {} rejected {} (queued={}, shutdown={})", name, message,
                    executor.getQueue().size(), executor.isShutdown());
            reply.completeExceptionally(WebException.from(e));
        }
        return reply;
    }

    /**
     * Sends {@code message} and waits for the reply.
     *
     * @throws WebException the operation's failure, kind {@code MAILBOX} if
     *                      the mailbox refused the message, or kind
     *                      {@code CANCELED} if no reply arrived in time
     */
    public <T> T ask(OperationMessage<R, S, T> message) {
        CompletableFuture<T> reply = send(message);
        try {
            return reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            reply.cancel(false);
            LOG.warn("EndpointWorker {} did not reply within {}ms", name, timeout.toMillis());
            throw WebException.from(e);
        } catch (InterruptedException e) {
            reply.cancel(false);
            Thread.currentThread().interrupt();
            throw WebException.from(e);
        } catch (CancellationException e) {
            throw WebException.from(e);
        } catch (ExecutionException e) {
            throw WebException.from(e);
        }
    }

    @Override
    public <T> T execute(Operation<R, S, T> operation) {
        return ask(operation.wrap());
    }

    private <T> void process(OperationMessage<R, S, T> message, CompletableFuture<T> reply) {
        if (reply.isDone()) {
            LOG.debug("EndpointWorker {} skipping {}: reply already completed", name, message);
            return;
        }
        try {
            reply.complete(message.intoInner().run(endpoint));
        } catch (RuntimeException e) {
            reply.completeExceptionally(e);
        }
    }

    public String name() {
        return name;
    }

    public int mailboxCapacity() {
        return mailboxCapacity;
    }

    /** Messages waiting behind the one in progress. */
    public int queued() {
        return executor.getQueue().size();
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    /** Stops accepting messages. Queued messages still run. */
    @Override
    public void close() {
        if (!executor.isShutdown()) {
            executor.shutdown();
            LOG.info("EndpointWorker stopped: name={}", name);
        }
    }

    /**
     * Closes the worker and waits for queued messages to finish.
     *
     * @return {@code true} if the worker drained within {@code wait}
     */
    public boolean closeAndAwait(Duration wait) throws InterruptedException {
        close();
        return executor.awaitTermination(wait.toMillis(), TimeUnit.MILLISECONDS);
    }
}
