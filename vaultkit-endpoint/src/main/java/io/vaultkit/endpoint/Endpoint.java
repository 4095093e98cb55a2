package io.vaultkit.endpoint;

import java.util.List;

/**
 * A typed description of a single HTTP exchange with Vault.
 *
 * <p>Implementations are normally generated: a record annotated with
 * {@link VaultEndpoint} implements the {@code <Record>Endpoint} interface produced
 * for it at compile time, and that interface supplies every method below from the
 * record's components. The client turns an endpoint into a request as follows:
 * <ul>
 *   <li>{@link #requestMethod()} becomes the HTTP verb ({@code LIST} is sent literally)</li>
 *   <li>{@link #requestPath()} is resolved against {@code {address}/v{version}/}</li>
 *   <li>{@link #queryParameters()} are percent-encoded into the query string</li>
 *   <li>{@link #requestBody()} is serialized as JSON when non-null</li>
 *   <li>the envelope's {@code data} block is decoded as {@link #responseType()}</li>
 * </ul>
 *
 * <p>Path values are substituted verbatim. A value containing {@code /} or {@code ?}
 * changes the shape of the URL, so callers embedding untrusted input must make sure
 * it is URL-safe first.
 *
 * @param <R> the decoded payload type, or {@link Void} when the endpoint returns none
 */
public interface Endpoint<R> {

    /**
     * Returns the HTTP verb for this endpoint.
     *
     * @return the request method
     */
    RequestMethod requestMethod();

    /**
     * Returns the expanded request path, relative to the versioned API root.
     *
     * <p>A leading slash is allowed and ignored, so {@code /auth/token/lookup-self}
     * and {@code auth/token/lookup-self} address the same resource.
     *
     * @return the request path
     */
    String requestPath();

    /**
     * Returns the query parameters in declaration order.
     *
     * @return the query parameters, never null
     */
    default List<QueryParameter> queryParameters() {
        return List.of();
    }

    /**
     * Returns the request body to be serialized as JSON, or null when the endpoint
     * sends no body.
     *
     * @return the body object, or null
     */
    default Object requestBody() {
        return null;
    }

    /**
     * Returns the type the envelope's {@code data} block is decoded into.
     *
     * @return the response type, {@code Void.class} when there is none
     */
    Class<R> responseType();
}
