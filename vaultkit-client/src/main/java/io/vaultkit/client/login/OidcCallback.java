package io.vaultkit.client.login;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.vaultkit.client.AuthInfo;
import io.vaultkit.client.ErrorKind;
import io.vaultkit.client.VaultClient;
import io.vaultkit.client.VaultException;
import io.vaultkit.client.api.auth.oidc.CallbackRequest;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The pending second phase of an {@link OidcLogin}.
 *
 * <p>Holds the local redirect listener. {@link #callback(VaultClient, String)} blocks until the
 * provider redirects the browser back, then completes the login and stops the listener.
 * A redirect carrying an {@code error} fails the login; requests with neither a code nor an
 * error get a 400 page and the listener keeps waiting.
 * {@link #close()} stops the listener early; a pending or later {@code callback} then fails
 * with a cancelled {@link ErrorKind#TRANSPORT} error.
 */
public final class OidcCallback implements MultiLoginCallback, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(OidcCallback.class);

    private static final byte[] SUCCESS_PAGE = ("<!DOCTYPE html><html><head><title>Vault</title></head>"
            + "<body><p>Signed in to Vault. You can close this window.</p></body></html>")
            .getBytes(StandardCharsets.UTF_8);
    private static final byte[] FAILURE_PAGE = ("<!DOCTYPE html><html><head><title>Vault</title></head>"
            + "<body><p>Vault sign-in failed. Check the terminal for details.</p></body></html>")
            .getBytes(StandardCharsets.UTF_8);

    private final HttpServer server;
    private final String authUrl;
    private final String redirectUri;
    private final String nonce;
    private final CompletableFuture<Redirect> redirect = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    record Redirect(String state, String code) {
    }

    OidcCallback(HttpServer server, String authUrl, String redirectUri, String nonce) {
        this.server = server;
        this.authUrl = authUrl;
        this.redirectUri = redirectUri;
        this.nonce = nonce;
        server.createContext(OidcLogin.CALLBACK_PATH, this::handleRedirect);
    }

    /** The provider URL to send the user's browser to. */
    public String getAuthUrl() {
        return authUrl;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    private void handleRedirect(HttpExchange exchange) throws IOException {
        Map<String, String> query = OidcLogin.queryParameters(exchange.getRequestURI().getRawQuery());
        String code = query.get("code");
        String state = query.get("state");
        String error = query.get("error");
        boolean ok = code != null && !code.isEmpty() && state != null;
        byte[] page = ok ? SUCCESS_PAGE : FAILURE_PAGE;
        try {
            exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
            exchange.sendResponseHeaders(ok ? 200 : 400, page.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(page);
            }
        } finally {
            // complete only after the page is out, callback() stops the listener right away
            if (ok) {
                logger.debug("Received OIDC redirect");
                redirect.complete(new Redirect(state, code));
            } else if (error != null) {
                String reason = query.getOrDefault("error_description", error);
                logger.warn("OIDC provider reported an error: {}", reason);
                redirect.completeExceptionally(new VaultException(ErrorKind.EMPTY_DATA,
                        "OIDC redirect did not carry an authorization code: " + reason));
            } else {
                logger.debug("Ignoring request to {} without code or error", OidcLogin.CALLBACK_PATH);
            }
        }
    }

    @Override
    public AuthInfo callback(VaultClient client, String mount) throws VaultException {
        Redirect received;
        try {
            received = redirect.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw VaultException.cancelled("Interrupted while waiting for the OIDC redirect", e);
        } catch (CancellationException e) {
            throw VaultException.cancelled("OIDC login was cancelled", e);
        } catch (ExecutionException e) {
            close();
            if (e.getCause() instanceof VaultException) {
                throw (VaultException) e.getCause();
            }
            throw VaultException.transport("OIDC redirect failed: " + e.getCause().getMessage(), e.getCause());
        }
        try {
            return client.auth(new CallbackRequest(mount, received.state(), nonce, received.code()));
        } finally {
            close();
        }
    }

    /**
     * Stops the redirect listener. Idempotent.
     */
    @Override
    public void close() {
        if (redirect.cancel(false)) {
            logger.debug("OIDC login cancelled before the redirect arrived");
        }
        if (closed.compareAndSet(false, true)) {
            server.stop(0);
        }
    }
}
