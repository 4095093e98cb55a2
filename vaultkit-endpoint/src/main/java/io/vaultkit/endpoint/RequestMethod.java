package io.vaultkit.endpoint;

import java.util.Locale;

/**
 * HTTP verbs understood by Vault, including its non-standard {@code LIST}.
 */
public enum RequestMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    LIST;

    /**
     * Parses a verb name, ignoring case.
     *
     * @param value the verb, e.g. {@code "list"}
     * @return the matching method
     * @throws IllegalArgumentException if the value is not a recognized verb
     */
    public static RequestMethod fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Request method cannot be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown request method: '" + value
                    + "'. Supported values: GET, POST, PUT, PATCH, DELETE, HEAD, LIST", e);
        }
    }
}
