package io.vaultkit.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.vaultkit.endpoint.QueryParameter;
import io.vaultkit.endpoint.RequestMethod;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import javax.net.ssl.SSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lightweight HTTP transport for the Vault REST API.
 *
 * <p>This class provides a thin wrapper around {@link HttpClient}. It handles:
 * <ul>
 *   <li>URL composition: {@code {address}/v{version}/{path}?{query}}</li>
 *   <li>Token-based authentication via the X-Vault-Token header</li>
 *   <li>Response wrapping via the X-Vault-Wrap-TTL header</li>
 *   <li>Namespace support via X-Vault-Namespace header (Vault Enterprise)</li>
 *   <li>JSON serialization of request bodies</li>
 *   <li>Error response classification</li>
 * </ul>
 *
 * <p>The transport holds no session state; the token is supplied per request by
 * {@link VaultClient}. It can be constructed around an injected {@link HttpClient}
 * for testing.
 */
public class VaultHttpClient {

    private static final Logger logger = LoggerFactory.getLogger(VaultHttpClient.class);

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    static final String HEADER_VAULT_REQUEST = "X-Vault-Request";
    static final String HEADER_VAULT_TOKEN = "X-Vault-Token";
    static final String HEADER_VAULT_NAMESPACE = "X-Vault-Namespace";
    static final String HEADER_VAULT_WRAP_TTL = "X-Vault-Wrap-TTL";
    private static final String CONTENT_TYPE_JSON = "application/json";

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String namespace;
    private final Duration requestTimeout;

    /**
     * Creates a transport for the given settings.
     *
     * @param settings   the client settings
     * @param sslContext custom SSL context for TLS configuration, or null for default
     */
    public VaultHttpClient(VaultClientSettings settings, SSLContext sslContext) {
        this(buildHttpClient(sslContext, settings.getTimeout()), settings.getAddress(), settings.getVersion(),
                settings.getNamespace(), settings.getTimeout());
    }

    /**
     * Creates a transport with an injected HttpClient (for testing).
     *
     * @param httpClient     the HTTP client to use
     * @param address        the Vault server URL
     * @param version        the API version
     * @param namespace      Vault namespace, or null
     * @param requestTimeout timeout for individual requests
     */
    public VaultHttpClient(HttpClient httpClient, String address, int version, String namespace,
                           Duration requestTimeout) {
        this.httpClient = httpClient;
        this.baseUrl = normalizeUrl(address) + "/v" + version;
        this.namespace = namespace;
        this.requestTimeout = requestTimeout != null ? requestTimeout : VaultClientSettings.DEFAULT_TIMEOUT;
    }

    private static HttpClient buildHttpClient(SSLContext sslContext, Duration timeout) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(timeout.compareTo(DEFAULT_CONNECT_TIMEOUT) < 0 ? timeout : DEFAULT_CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL);

        if (sslContext != null) {
            builder.sslContext(sslContext);
        }

        return builder.build();
    }

    private static String normalizeUrl(String url) {
        // Remove trailing slash for consistent URL building
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Sends one request and returns the raw response.
     *
     * @param method  the HTTP verb
     * @param path    the request path relative to the versioned root; a leading slash is ignored
     * @param query   query parameters, encoded here
     * @param body    the body to serialize as JSON, or null for none
     * @param token   the session token, or null/empty to send none
     * @param wrapTtl the wrap TTL, or null when the response should not be wrapped
     * @return the raw response, status 2xx
     * @throws VaultException {@code API} for error statuses, {@code TRANSPORT} when no response
     *                        was received, {@code SERIALIZATION} when the body cannot be encoded
     */
    public Response send(RequestMethod method, String path, List<QueryParameter> query, Object body,
                         String token, String wrapTtl) throws VaultException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(buildUri(path, query))
                .timeout(requestTimeout)
                .header(HEADER_VAULT_REQUEST, "true");

        if (token != null && !token.isBlank()) {
            builder.header(HEADER_VAULT_TOKEN, token);
        }
        if (namespace != null && !namespace.isBlank()) {
            builder.header(HEADER_VAULT_NAMESPACE, namespace);
        }
        if (wrapTtl != null) {
            builder.header(HEADER_VAULT_WRAP_TTL, wrapTtl);
        }

        HttpRequest.BodyPublisher publisher = HttpRequest.BodyPublishers.noBody();
        if (body != null) {
            try {
                publisher = HttpRequest.BodyPublishers.ofByteArray(VaultJson.MAPPER.writeValueAsBytes(body));
            } catch (JsonProcessingException e) {
                throw new VaultException(ErrorKind.SERIALIZATION,
                        "Cannot serialize request body for " + path + ": " + e.getOriginalMessage(), e);
            }
            builder.header("Content-Type", CONTENT_TYPE_JSON);
        }

        return execute(builder.method(method.name(), publisher).build());
    }

    /**
     * Builds the request URI. Path characters that are illegal in a URI, such as spaces, are
     * percent-quoted; everything else, including {@code /}, is kept as given.
     *
     * @throws VaultException {@code CLIENT_BUILD} if no URI can be formed from the path
     */
    URI buildUri(String path, List<QueryParameter> query) throws VaultException {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        StringBuilder url;
        try {
            URI base = URI.create(baseUrl);
            url = new StringBuilder(new URI(base.getScheme(), base.getRawAuthority(),
                    base.getPath() + "/" + relative, null, null).toASCIIString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new VaultException(ErrorKind.CLIENT_BUILD, "Invalid request path '" + path + "': " + e.getMessage(), e);
        }
        if (query != null && !query.isEmpty()) {
            char separator = '?';
            for (QueryParameter parameter : query) {
                url.append(separator)
                        .append(URLEncoder.encode(parameter.name(), StandardCharsets.UTF_8))
                        .append('=')
                        .append(URLEncoder.encode(parameter.value(), StandardCharsets.UTF_8));
                separator = '&';
            }
        }
        return URI.create(url.toString());
    }

    private Response execute(HttpRequest request) throws VaultException {
        logger.debug("Vault request: {} {}", request.method(), request.uri());

        try {
            HttpResponse<byte[]> response = httpClient.send(
                    request, HttpResponse.BodyHandlers.ofByteArray());

            int status = response.statusCode();
            byte[] body = response.body() != null ? response.body() : new byte[0];

            logger.debug("Vault response: {} {} -> {} ({} bytes)", request.method(), request.uri().getPath(),
                    status, body.length);

            if (status < 200 || status >= 300) {
                VaultException error = VaultException.fromResponse(status, new String(body, StandardCharsets.UTF_8));
                logger.debug("Vault error on {} {}: {}", request.method(), request.uri().getPath(), error.getMessage());
                throw error;
            }

            return new Response(status, body, response.headers());

        } catch (HttpTimeoutException e) {
            throw VaultException.transport("Request timed out after " + requestTimeout + ": " + request.uri(), e);
        } catch (IOException e) {
            // Connection errors get status 0
            throw VaultException.transport("Connection failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw VaultException.cancelled("Request interrupted", e);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * A successful raw response.
     *
     * @param status  the HTTP status code
     * @param body    the body bytes, empty when there was none
     * @param headers the response headers
     */
    public record Response(int status, byte[] body, HttpHeaders headers) {

        /** True for 204 and for any response without a body. */
        public boolean isEmpty() {
            return status == 204 || body.length == 0;
        }
    }
}
