package io.vaultkit.client.login;

import com.sun.net.httpserver.HttpServer;
import io.vaultkit.client.ErrorKind;
import io.vaultkit.client.VaultClient;
import io.vaultkit.client.VaultException;
import io.vaultkit.client.api.auth.oidc.AuthUrlRequest;
import io.vaultkit.client.api.auth.oidc.AuthUrlResponse;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Browser-based login with the OIDC auth method.
 *
 * <p>The first phase starts a listener on {@code 127.0.0.1:<port>} and asks Vault for the
 * provider's authorization URL, using {@code http://localhost:<port>/oidc/callback} as redirect
 * URI. The role must allow that URI. The caller then sends the user to
 * {@link OidcCallback#getAuthUrl()}; once the provider redirects back, the callback exchanges
 * the redirect's state and code for a Vault token.
 *
 * <pre>{@code
 * try (OidcCallback callback = client.loginMulti("oidc", new OidcLogin(null, "dev"))) {
 *     openBrowser(callback.getAuthUrl());
 *     client.loginMultiCallback("oidc", callback);
 * }
 * }</pre>
 */
public final class OidcLogin implements MultiLoginMethod<OidcCallback> {

    private static final Logger logger = LoggerFactory.getLogger(OidcLogin.class);

    /** Listener port used when none is given, the same as the Vault CLI's. */
    public static final int DEFAULT_PORT = 8250;

    static final String CALLBACK_PATH = "/oidc/callback";

    private final int port;
    private final String role;

    /**
     * @param port listener port; {@link #DEFAULT_PORT} when null, any free port when 0
     * @param role the role to log in with, or null for the mount's default role
     */
    public OidcLogin(Integer port, String role) {
        this.port = port != null ? port : DEFAULT_PORT;
        if (this.port < 0 || this.port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + this.port);
        }
        this.role = role;
    }

    @Override
    public AuthMethodType getAuthMethod() {
        return AuthMethodType.OIDC;
    }

    @Override
    public OidcCallback login(VaultClient client, String mount) throws VaultException {
        HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
        } catch (IOException e) {
            throw VaultException.transport("Cannot listen for the OIDC redirect on 127.0.0.1:" + port
                    + ": " + e.getMessage(), e);
        }
        int boundPort = server.getAddress().getPort();
        String redirectUri = "http://localhost:" + boundPort + CALLBACK_PATH;

        try {
            AuthUrlResponse response = client.execute(new AuthUrlRequest(mount, role, redirectUri));
            String authUrl = response.authUrl();
            if (authUrl == null || authUrl.isBlank()) {
                throw new VaultException(ErrorKind.EMPTY_DATA, "Vault returned no OIDC authorization URL; "
                        + "check that role '" + role + "' allows redirect URI " + redirectUri);
            }
            String nonce = queryParameters(URI.create(authUrl).getRawQuery()).get("nonce");
            OidcCallback callback = new OidcCallback(server, authUrl, redirectUri, nonce);
            server.start();
            logger.info("Waiting for the OIDC redirect on {}", redirectUri);
            return callback;
        } catch (VaultException | RuntimeException e) {
            server.stop(0);
            throw e;
        }
    }

    /**
     * Decodes a raw query string. Repeated names keep their first value.
     */
    static Map<String, String> queryParameters(String rawQuery) {
        Map<String, String> parameters = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return parameters;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            parameters.putIfAbsent(URLDecoder.decode(name, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return parameters;
    }

    @Override
    public String toString() {
        return "OidcLogin{port=" + port + ", role='" + role + "'}";
    }
}
