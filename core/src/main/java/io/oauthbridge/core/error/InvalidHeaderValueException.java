package io.oauthbridge.core.error;

/**
 * Thrown when a response header value contains characters that cannot be
 * sent on the wire (control characters other than horizontal tab, DEL, or
 * characters outside ISO-8859-1).
 */
public final class InvalidHeaderValueException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String headerName;

    public InvalidHeaderValueException(String headerName, String message) {
        super(message);
        this.headerName = headerName;
    }

    /** Name of the header whose value was rejected. */
    public String headerName() {
        return headerName;
    }
}
