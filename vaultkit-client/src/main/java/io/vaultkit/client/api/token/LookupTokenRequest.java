package io.vaultkit.client.api.token;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/token/lookup", response = LookupTokenResponse.class)
public record LookupTokenRequest(String token) implements LookupTokenRequestEndpoint {
}
