package io.oauthbridge.core.web;

import io.oauthbridge.core.error.InvalidHeaderValueException;

/** Validation of outgoing header values. */
final class HeaderValues {

    private HeaderValues() {
        // utility class
    }

    /**
     * Returns {@code value} if it can be written as a header value: horizontal
     * tab, visible ASCII and space, or ISO-8859-1 characters above DEL.
     *
     * @throws InvalidHeaderValueException otherwise
     */
    static String validate(String name, String value) {
        if (value == null) {
            throw new InvalidHeaderValueException(name, "null value for header " + name);
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean valid = c == '\t' || (c >= 0x20 && c != 0x7F && c <= 0xFF);
            if (!valid) {
                throw new InvalidHeaderValueException(
                        name, String.format("invalid character 0x%02X at index %d in header %s", (int) c, i, name));
            }
        }
        return value;
    }
}
