package io.vaultkit.client.api.auth.oidc;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Requests the provider authorization URL that starts an OIDC login.
 *
 * @param mount       the auth mount, usually {@code oidc}
 * @param role        the role to log in with, or null for the mount's default role
 * @param redirectUri where the provider sends the browser afterwards; must be allowed by the role
 */
@VaultEndpoint(path = "auth/{self.mount}/oidc/auth_url", method = "POST", response = AuthUrlResponse.class)
public record AuthUrlRequest(String mount, String role, String redirectUri) implements AuthUrlRequestEndpoint {
}
