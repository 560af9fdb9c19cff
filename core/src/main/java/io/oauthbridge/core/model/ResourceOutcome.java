package io.oauthbridge.core.model;

import io.oauthbridge.core.spi.WebResponse;
import java.util.Objects;

/**
 * Outcome of a resource check. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#GRANTED}: access is allowed; {@code grant} holds the
 * authorization.</li>
 * <li>{@link Type#DENIED}: access is refused; {@code response} holds what
 * the engine wants the client to see (typically 401 with
 * {@code WWW-Authenticate}).</li>
 * </ul>
 *
 * @param <S> the response type the engine prepared
 */
public final class ResourceOutcome<S extends WebResponse> {

    /** The type of resource check outcome. */
    public enum Type {
        GRANTED,
        DENIED
    }

    private final Type type;
    private final Grant grant;
    private final S response;

    private ResourceOutcome(Type type, Grant grant, S response) {
        this.type = type;
        this.grant = grant;
        this.response = response;
    }

    public static <S extends WebResponse> ResourceOutcome<S> granted(Grant grant) {
        Objects.requireNonNull(grant, "grant must not be null for GRANTED");
        return new ResourceOutcome<>(Type.GRANTED, grant, null);
    }

    public static <S extends WebResponse> ResourceOutcome<S> denied(S response) {
        Objects.requireNonNull(response, "response must not be null for DENIED");
        return new ResourceOutcome<>(Type.DENIED, null, response);
    }

    public Type type() {
        return type;
    }

    public boolean isGranted() {
        return type == Type.GRANTED;
    }

    /** Only valid when {@code type() == GRANTED}. */
    public Grant grant() {
        return grant;
    }

    /** Only valid when {@code type() == DENIED}. */
    public S response() {
        return response;
    }

    @Override
    public String toString() {
        return "ResourceOutcome{type=" + type + (grant != null ? ", client=" + grant.clientId() : "") + "}";
    }
}
