package io.vaultkit.client.api.token;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/token/revoke-accessor")
public record RevokeTokenAccessorRequest(String accessor) implements RevokeTokenAccessorRequestEndpoint {
}
