package io.vaultkit.endpoint;

import java.util.Objects;

/**
 * A single {@code name=value} pair of a request's query string, before encoding.
 *
 * @param name  the parameter name
 * @param value the parameter value
 */
public record QueryParameter(String name, String value) {

    public QueryParameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
