package io.vaultkit.endpoint;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers called from generated endpoint code.
 *
 * <p>Absent values, meaning {@code null} or an empty {@link Optional}, are never
 * written: Vault distinguishes an unset field from an empty one.
 */
public final class EndpointSupport {

    private EndpointSupport() {
    }

    /**
     * Returns the value of a path placeholder.
     *
     * @param name  the component name, for the error message
     * @param value the component value
     * @return the value, unchanged
     * @throws IllegalArgumentException if the value is null
     */
    public static String pathValue(String name, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Path field '" + name + "' cannot be null");
        }
        return value;
    }

    /**
     * Puts a body field unless its value is absent.
     *
     * @param body  the body being built
     * @param key   the JSON key
     * @param value the value, possibly null or an {@link Optional}
     */
    public static void putIfPresent(Map<String, Object> body, String key, Object value) {
        Object unwrapped = unwrap(value);
        if (unwrapped != null) {
            body.put(key, unwrapped);
        }
    }

    /**
     * Adds a query parameter unless its value is absent. A collection adds one
     * parameter per non-null element.
     *
     * @param query the parameters being built
     * @param name  the parameter name
     * @param value the value, possibly null, an {@link Optional} or a collection
     */
    public static void addQuery(List<QueryParameter> query, String name, Object value) {
        Object unwrapped = unwrap(value);
        if (unwrapped == null) {
            return;
        }
        if (unwrapped instanceof Collection) {
            for (Object element : (Collection<?>) unwrapped) {
                if (element != null) {
                    query.add(new QueryParameter(name, String.valueOf(element)));
                }
            }
            return;
        }
        query.add(new QueryParameter(name, String.valueOf(unwrapped)));
    }

    private static Object unwrap(Object value) {
        if (value instanceof Optional) {
            return ((Optional<?>) value).orElse(null);
        }
        return value;
    }
}
