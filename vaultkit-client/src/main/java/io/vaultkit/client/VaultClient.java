package io.vaultkit.client;

import io.vaultkit.client.api.sys.ReadSealStatusRequest;
import io.vaultkit.client.api.sys.SealStatusResponse;
import io.vaultkit.client.api.sys.WrappingLookupRequest;
import io.vaultkit.client.api.sys.WrappingLookupResponse;
import io.vaultkit.client.api.sys.WrappingUnwrapRequest;
import io.vaultkit.client.api.token.LookupSelfTokenRequest;
import io.vaultkit.client.api.token.LookupTokenResponse;
import io.vaultkit.client.api.token.RenewSelfTokenRequest;
import io.vaultkit.client.api.token.RevokeSelfTokenRequest;
import io.vaultkit.client.login.LoginMethod;
import io.vaultkit.client.login.MultiLoginCallback;
import io.vaultkit.client.login.MultiLoginMethod;
import io.vaultkit.endpoint.Endpoint;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import javax.net.ssl.SSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes {@link Endpoint}s against a Vault server.
 *
 * <p>The client pairs immutable {@link VaultClientSettings} with a {@link VaultHttpClient}
 * transport. Its only mutable state is the session token, which the login methods
 * replace. Requests may be issued concurrently; logging in while other requests are in
 * flight is left to the caller to coordinate.
 *
 * <p>Every operation is a single attempt: nothing is retried, and a 403 does not trigger a
 * token renewal. An interrupted calling thread aborts the request with a cancelled
 * {@link ErrorKind#TRANSPORT} error.
 *
 * <p>Example usage:
 * <pre>{@code
 * VaultClient client = new VaultClient(VaultClientSettings.builder()
 *         .address("https://vault:8200")
 *         .build());
 * client.login("approle", AppRoleLogin.of(roleId, secretId));
 * ReadSecretResponse secret = client.execute(new ReadSecretRequest("secret", "app/db", null));
 * }</pre>
 */
public class VaultClient {

    private static final Logger logger = LoggerFactory.getLogger(VaultClient.class);

    /** Wrap TTL used by {@link #wrap(Endpoint)}. */
    public static final String DEFAULT_WRAP_TTL = "10m";

    private final VaultClientSettings settings;
    private final VaultHttpClient transport;
    private volatile String token;

    /**
     * Creates a client, loading TLS material from the settings once.
     *
     * @param settings the connection settings
     * @throws VaultException {@code CERT_READ}, {@code CERT_PARSE} or {@code CLIENT_BUILD}
     *                        when the TLS configuration cannot be loaded
     */
    public VaultClient(VaultClientSettings settings) throws VaultException {
        this(settings, new VaultHttpClient(settings, buildSslContext(settings)));
    }

    /**
     * Creates a client around an existing transport (for testing).
     *
     * @param settings  the connection settings
     * @param transport the transport to send requests with
     */
    public VaultClient(VaultClientSettings settings, VaultHttpClient transport) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.token = settings.getToken();
    }

    /**
     * Creates a client configured entirely from the {@code VAULT_*} environment variables.
     *
     * @return the client
     * @throws VaultException if the environment holds invalid settings
     */
    public static VaultClient fromEnvironment() throws VaultException {
        return new VaultClient(VaultClientSettings.builder().build());
    }

    private static SSLContext buildSslContext(VaultClientSettings settings) throws VaultException {
        return TlsContextFactory.isCustomized(settings) ? TlsContextFactory.create(settings) : null;
    }

    public VaultClientSettings getSettings() {
        return settings;
    }

    public String getToken() {
        return token;
    }

    /**
     * Replaces the session token sent as {@code X-Vault-Token}.
     *
     * @param token the new token, or null/empty to send none
     */
    public void setToken(String token) {
        this.token = token != null ? token : "";
    }

    /**
     * Executes an endpoint and returns the whole decoded envelope.
     *
     * <p>If Vault wrapped the response, for example because a policy enforces wrapping,
     * {@link VaultResponse#isWrapped()} is true and the payload is only reachable through
     * {@link #unwrap(WrapInfo, Class)}.
     *
     * @param endpoint the endpoint to execute
     * @return the envelope; {@link VaultResponse#isEmpty() empty} for a 204
     * @throws VaultException if the request fails or the response cannot be decoded
     */
    public <R> VaultResponse<R> request(Endpoint<R> endpoint) throws VaultException {
        return send(endpoint, endpoint.responseType(), null);
    }

    /**
     * Executes an endpoint and returns its {@code data} block.
     *
     * <p>For endpoints without a response type the body is discarded and null is returned.
     *
     * @param endpoint the endpoint to execute
     * @return the decoded payload
     * @throws VaultException {@code EMPTY_RESPONSE} if a payload was expected but the body was
     *                        empty, {@code EMPTY_DATA} if the envelope had no {@code data}
     */
    public <R> R execute(Endpoint<R> endpoint) throws VaultException {
        VaultResponse<R> response = request(endpoint);
        if (endpoint.responseType() == Void.class) {
            return null;
        }
        return requireData(response, endpoint.requestPath());
    }

    /**
     * Executes an endpoint whose response, if any, is of no interest.
     *
     * @param endpoint the endpoint to execute
     * @throws VaultException if the request fails
     */
    public void executeEmpty(Endpoint<?> endpoint) throws VaultException {
        send(endpoint, Void.class, null);
    }

    /**
     * Executes an endpoint whose response is not enveloped, decoding the whole body as the
     * endpoint's response type. Used for {@code sys/health} and {@code sys/seal-status}.
     *
     * @param endpoint the endpoint to execute
     * @return the decoded body
     * @throws VaultException {@code EMPTY_RESPONSE} for an empty body, {@code SERIALIZATION} if
     *                        it cannot be decoded
     */
    public <R> R executeRaw(Endpoint<R> endpoint) throws VaultException {
        VaultHttpClient.Response response = transport.send(endpoint.requestMethod(), endpoint.requestPath(),
                endpoint.queryParameters(), endpoint.requestBody(), token, null);
        if (response.isEmpty()) {
            throw new VaultException(ErrorKind.EMPTY_RESPONSE,
                    "Expected a response from " + endpoint.requestPath() + " but the body was empty");
        }
        try {
            return VaultJson.MAPPER.readValue(response.body(), endpoint.responseType());
        } catch (IOException e) {
            throw new VaultException(ErrorKind.SERIALIZATION, "Cannot decode response from "
                    + endpoint.requestPath() + " as " + endpoint.responseType().getSimpleName() + ": "
                    + e.getMessage(), e);
        }
    }

    /**
     * Executes a token-issuing endpoint and returns the envelope's {@code auth} block.
     * The client's own token is not changed.
     *
     * @param endpoint the endpoint to execute
     * @return the auth block
     * @throws VaultException {@code EMPTY_RESPONSE} if the response had no {@code auth} block
     */
    public AuthInfo auth(Endpoint<?> endpoint) throws VaultException {
        VaultResponse<?> response = send(endpoint, Void.class, null);
        if (response.getAuth() == null) {
            throw new VaultException(ErrorKind.EMPTY_RESPONSE,
                    "Response from " + endpoint.requestPath() + " has no auth block");
        }
        return response.getAuth();
    }

    /**
     * Logs in with a single-shot method and adopts the issued token.
     *
     * @param mount  the mount path of the auth method
     * @param method the credentials
     * @return the auth block of the login response
     * @throws VaultException if the login fails
     */
    public AuthInfo login(String mount, LoginMethod method) throws VaultException {
        Preconditions.requireNonBlank(mount, "Mount");
        AuthInfo info = method.login(this, mount);
        adoptToken(info);
        logger.info("{} login successful at mount '{}'", method.getAuthMethod(), mount);
        return info;
    }

    /**
     * Logs in with a single-shot method at the method's default mount.
     */
    public AuthInfo login(LoginMethod method) throws VaultException {
        return login(method.getAuthMethod().getValue(), method);
    }

    /**
     * Starts a two-phase login. The returned callback completes it through
     * {@link #loginMultiCallback(String, MultiLoginCallback)}.
     *
     * @param mount  the mount path of the auth method
     * @param method the first-phase parameters
     * @return the callback to complete the login with
     * @throws VaultException if the first phase fails
     */
    public <C extends MultiLoginCallback> C loginMulti(String mount, MultiLoginMethod<C> method)
            throws VaultException {
        Preconditions.requireNonBlank(mount, "Mount");
        return method.login(this, mount);
    }

    /**
     * Completes a two-phase login and adopts the issued token.
     *
     * @param mount    the mount path used for the first phase
     * @param callback the callback returned by {@link #loginMulti}
     * @return the auth block of the login response
     * @throws VaultException if the second phase fails or is cancelled
     */
    public AuthInfo loginMultiCallback(String mount, MultiLoginCallback callback) throws VaultException {
        Preconditions.requireNonBlank(mount, "Mount");
        AuthInfo info = callback.callback(this, mount);
        adoptToken(info);
        logger.info("Two-phase login successful at mount '{}'", mount);
        return info;
    }

    private void adoptToken(AuthInfo info) throws VaultException {
        if (info.clientToken() == null || info.clientToken().isBlank()) {
            throw new VaultException(ErrorKind.EMPTY_RESPONSE, "Login response missing 'client_token'");
        }
        setToken(info.clientToken());
    }

    /**
     * Looks up the client's own token.
     *
     * @return the token properties
     * @throws VaultException if the lookup fails
     */
    public LookupTokenResponse lookup() throws VaultException {
        return execute(new LookupSelfTokenRequest());
    }

    /**
     * Renews the client's own token.
     *
     * @param increment requested extension such as {@code 1h}, or null for the token's default
     * @return the renewed lease
     * @throws VaultException if the token cannot be renewed
     */
    public AuthInfo renew(String increment) throws VaultException {
        return auth(new RenewSelfTokenRequest(increment));
    }

    /**
     * Revokes the client's own token. The client keeps sending it afterwards.
     *
     * @throws VaultException if the revocation fails
     */
    public void revoke() throws VaultException {
        executeEmpty(new RevokeSelfTokenRequest());
    }

    /**
     * Reads the server's seal status. Needs no token.
     *
     * @return the seal status
     * @throws VaultException if the server cannot be reached
     */
    public SealStatusResponse status() throws VaultException {
        return executeRaw(new ReadSealStatusRequest());
    }

    /**
     * Executes an endpoint in wrap mode with {@link #DEFAULT_WRAP_TTL}.
     */
    public <R> WrappedResponse<R> wrap(Endpoint<R> endpoint) throws VaultException {
        return wrap(endpoint, DEFAULT_WRAP_TTL);
    }

    /**
     * Executes an endpoint in wrap mode with a TTL in whole seconds.
     */
    public <R> WrappedResponse<R> wrap(Endpoint<R> endpoint, Duration ttl) throws VaultException {
        Objects.requireNonNull(ttl, "ttl");
        return wrap(endpoint, String.valueOf(ttl.toSeconds()));
    }

    /**
     * Executes an endpoint in wrap mode: Vault stores the response behind a single-use
     * wrapping token instead of returning it.
     *
     * @param endpoint the endpoint whose response is wrapped
     * @param ttl      wrapping TTL as a duration string ({@code "60s"}, {@code "10m"}) or seconds
     * @return the wrapping token and the endpoint's response type
     * @throws VaultException {@code EMPTY_DATA} if Vault did not wrap the response
     */
    public <R> WrappedResponse<R> wrap(Endpoint<R> endpoint, String ttl) throws VaultException {
        Preconditions.requireNonBlank(ttl, "Wrap TTL");
        VaultResponse<Void> response = send(endpoint, Void.class, ttl);
        if (response.isEmpty()) {
            throw new VaultException(ErrorKind.EMPTY_RESPONSE,
                    "Vault returned no response to wrap for " + endpoint.requestPath());
        }
        if (!response.isWrapped()) {
            throw new VaultException(ErrorKind.EMPTY_DATA,
                    "Response from " + endpoint.requestPath() + " was not wrapped");
        }
        return new WrappedResponse<>(response.getWrapInfo(), endpoint.responseType());
    }

    /**
     * Reads a wrapping token's metadata without consuming it.
     *
     * @param wrapInfo the wrapping token
     * @return the metadata
     * @throws VaultException {@code WRAP_INVALID} if the token is expired or already unwrapped
     */
    public WrappingLookupResponse wrapLookup(WrapInfo wrapInfo) throws VaultException {
        try {
            return execute(new WrappingLookupRequest(wrapInfo.token()));
        } catch (VaultException e) {
            throw translateWrapError(e);
        }
    }

    /**
     * Exchanges a wrapping token for the payload it protects. The token is consumed.
     *
     * @param wrapInfo     the wrapping token
     * @param responseType the type of the wrapped {@code data} block
     * @return the original payload
     * @throws VaultException {@code WRAP_INVALID} if the token is expired or already unwrapped
     */
    public <R> R unwrap(WrapInfo wrapInfo, Class<R> responseType) throws VaultException {
        WrappingUnwrapRequest endpoint = new WrappingUnwrapRequest(wrapInfo.token());
        VaultResponse<R> response;
        try {
            response = send(endpoint, responseType, null);
        } catch (VaultException e) {
            throw translateWrapError(e);
        }
        if (responseType == Void.class) {
            return null;
        }
        return requireData(response, endpoint.requestPath());
    }

    private static VaultException translateWrapError(VaultException e) {
        // Vault answers 400 for wrapping tokens that are expired, unknown or consumed
        if (e.getKind() == ErrorKind.API && e.getHttpStatusCode() == 400) {
            return VaultException.wrapInvalid(e);
        }
        return e;
    }

    private <R> VaultResponse<R> send(Endpoint<?> endpoint, Class<R> dataType, String wrapTtl)
            throws VaultException {
        VaultHttpClient.Response raw = transport.send(endpoint.requestMethod(), endpoint.requestPath(),
                endpoint.queryParameters(), endpoint.requestBody(), token, wrapTtl);
        if (raw.isEmpty()) {
            return VaultResponse.empty(raw.status());
        }
        VaultResponse<R> response = VaultResponse.fromJson(raw.status(), raw.body(), dataType);
        for (String warning : response.getWarnings()) {
            logger.warn("Vault warning for {} {}: {}", endpoint.requestMethod(), endpoint.requestPath(), warning);
        }
        return response;
    }

    private static <R> R requireData(VaultResponse<R> response, String path) throws VaultException {
        if (response.isEmpty()) {
            throw new VaultException(ErrorKind.EMPTY_RESPONSE,
                    "Expected a response from " + path + " but the body was empty");
        }
        if (response.getData() == null) {
            String detail = response.isWrapped() ? " (the response was wrapped)" : "";
            throw new VaultException(ErrorKind.EMPTY_DATA, "Response from " + path + " has no data" + detail);
        }
        return response.getData();
    }
}
