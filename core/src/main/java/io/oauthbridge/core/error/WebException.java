package io.oauthbridge.core.error;

import io.oauthbridge.core.model.OAuthError;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * The single error type of the adapter layer.
 *
 * <p>
 * Every failure the layer can observe (header construction, query and body
 * extraction, worker dispatch, and protocol errors raised by the engine) is
 * converted into a {@code WebException} tagged with one {@link Kind}. The
 * conversions are the static {@code from(...)} factories; nothing converts a
 * {@code WebException} back into its origin.
 *
 * <p>
 * How a kind maps to an HTTP status is decided by {@link ErrorStatusPolicy},
 * never by the exception itself.
 */
public final class WebException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Closed set of failure origins. */
    public enum Kind {
        /** Protocol error raised by the engine. */
        ENDPOINT("endpoint", "Endpoint"),
        /** A response header value could not be constructed. */
        HEADER("header", "Couldn't set header"),
        /** The request payload could not be decoded. */
        ENCODING("encoding", "Error decoding request"),
        /** The request body is not a form. */
        FORM("form", "Request is not a form"),
        /** The query was absent or could not be parsed. */
        QUERY("query", "No query present"),
        /** The request had no usable form body. */
        BODY("body", "No body present"),
        /** The request carried more than one Authorization header. */
        AUTHORIZATION("authorization", "Request has invalid Authorization headers"),
        /** Processing was canceled or timed out before a reply arrived. */
        CANCELED("canceled", "Operation canceled"),
        /** The worker mailbox was full or closed. */
        MAILBOX("mailbox", "An endpoint worker's mailbox was full");

        private final String id;
        private final String description;

        Kind(String id, String description) {
            this.id = id;
            this.description = description;
        }

        /** Stable lowercase identifier, used in configuration keys and URNs. */
        public String id() {
            return id;
        }

        /** Fixed human-readable description. */
        public String description() {
            return description;
        }

        /** URN identifying this kind in problem responses. */
        public String urn() {
            return URN_PREFIX + id;
        }

        /**
         * Resolves a kind from its {@link #id()} (case-insensitive).
         *
         * @throws IllegalArgumentException if no kind has that id
         */
        public static Kind fromId(String id) {
            for (Kind kind : values()) {
                if (kind.id.equalsIgnoreCase(id)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown error kind: " + id);
        }
    }

    public static final String URN_PREFIX = "urn:oauth-bridge:error:";

    private final Kind kind;
    private final OAuthError oauthError;

    private WebException(Kind kind, String message, Throwable cause, OAuthError oauthError) {
        super(message, cause);
        this.kind = kind;
        this.oauthError = oauthError;
    }

    // ── Plain kinds ──

    public static WebException encoding(Throwable cause) {
        return withCause(Kind.ENCODING, cause);
    }

    public static WebException form() {
        return of(Kind.FORM);
    }

    public static WebException query() {
        return of(Kind.QUERY);
    }

    public static WebException query(Throwable cause) {
        return withCause(Kind.QUERY, cause);
    }

    public static WebException body() {
        return of(Kind.BODY);
    }

    public static WebException authorization() {
        return of(Kind.AUTHORIZATION);
    }

    public static WebException canceled() {
        return of(Kind.CANCELED);
    }

    public static WebException mailbox() {
        return of(Kind.MAILBOX);
    }

    // ── Conversions ──

    /** Protocol error from the engine. Keeps the {@link OAuthError}. */
    public static WebException from(OAuthException e) {
        return new WebException(
                Kind.ENDPOINT, Kind.ENDPOINT.description() + ", " + e.getMessage(), e, e.error());
    }

    /** Protocol error reported without an exception. */
    public static WebException endpoint(OAuthError error) {
        return new WebException(Kind.ENDPOINT, Kind.ENDPOINT.description() + ", " + error.description(), null, error);
    }

    public static WebException from(InvalidHeaderValueException e) {
        return withCause(Kind.HEADER, e);
    }

    /** A rejected submission means the mailbox is full or the worker is closed. */
    public static WebException from(RejectedExecutionException e) {
        return withCause(Kind.MAILBOX, e);
    }

    public static WebException from(TimeoutException e) {
        return withCause(Kind.CANCELED, e);
    }

    public static WebException from(CancellationException e) {
        return withCause(Kind.CANCELED, e);
    }

    /** The caller stopped waiting. The interrupt flag is the caller's to restore. */
    public static WebException from(InterruptedException e) {
        return withCause(Kind.CANCELED, e);
    }

    /**
     * Unwraps the failure of an asynchronously executed operation. A
     * {@code WebException} cause is returned unchanged, engine errors become
     * {@link Kind#ENDPOINT}, cancellation becomes {@link Kind#CANCELED}.
     * Any other cause is not an adapter failure and is rethrown as is.
     */
    public static WebException from(ExecutionException e) {
        return unwrap(e.getCause(), e);
    }

    /** Same as {@link #from(ExecutionException)} for {@code CompletableFuture.join()}. */
    public static WebException from(CompletionException e) {
        return unwrap(e.getCause(), e);
    }

    private static WebException unwrap(Throwable cause, Exception carrier) {
        if (cause instanceof WebException web) {
            return web;
        }
        if (cause instanceof OAuthException oauth) {
            return from(oauth);
        }
        if (cause instanceof CancellationException cancellation) {
            return from(cancellation);
        }
        if (cause instanceof RejectedExecutionException rejected) {
            return from(rejected);
        }
        if (cause instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        throw new IllegalStateException("Operation failed with an unexpected exception", carrier);
    }

    private static WebException of(Kind kind) {
        return new WebException(kind, kind.description(), null, null);
    }

    private static WebException withCause(Kind kind, Throwable cause) {
        Objects.requireNonNull(cause, "cause must not be null");
        String detail = cause.getMessage();
        String message = detail != null && !detail.isBlank() ? kind.description() + ", " + detail : kind.description();
        return new WebException(kind, message, cause, null);
    }

    // ── Accessors ──

    public Kind kind() {
        return kind;
    }

    /** The engine's protocol error, or {@code null} unless {@code kind() == ENDPOINT}. */
    public OAuthError oauthError() {
        return oauthError;
    }

    /**
     * {@code true} for dispatch failures ({@link Kind#CANCELED},
     * {@link Kind#MAILBOX}) that may succeed when retried. The layer itself
     * never retries.
     */
    public boolean isTransient() {
        return kind == Kind.CANCELED || kind == Kind.MAILBOX;
    }
}
