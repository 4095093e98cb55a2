/**
 * JWT/OIDC auth method.
 *
 * <p>The browser flow takes two requests: {@link io.vaultkit.client.api.auth.oidc.AuthUrlRequest}
 * returns the provider URL to send the user to, and
 * {@link io.vaultkit.client.api.auth.oidc.CallbackRequest} exchanges the state and code the
 * provider redirects back with for a Vault token. {@code io.vaultkit.client.login.OidcLogin}
 * runs both. {@link io.vaultkit.client.api.auth.oidc.JwtLoginRequest} logs in with a JWT the
 * caller already holds.
 */
package io.vaultkit.client.api.auth.oidc;
