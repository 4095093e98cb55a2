package io.vaultkit.client.api.auth.oidc;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Completes an OIDC login. The token is in the envelope's {@code auth} block.
 *
 * @param mount the auth mount
 * @param state the {@code state} the provider redirected with
 * @param nonce the {@code nonce} of the authorization URL
 * @param code  the authorization code the provider redirected with
 */
@VaultEndpoint(path = "auth/{self.mount}/oidc/callback")
public record CallbackRequest(
        String mount,
        @VaultEndpoint.Query String state,
        @VaultEndpoint.Query String nonce,
        @VaultEndpoint.Query String code) implements CallbackRequestEndpoint {
}
