package io.vaultkit.client.api.token;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Revokes a token and all its children.
 */
@VaultEndpoint(path = "auth/token/revoke")
public record RevokeTokenRequest(String token) implements RevokeTokenRequestEndpoint {
}
