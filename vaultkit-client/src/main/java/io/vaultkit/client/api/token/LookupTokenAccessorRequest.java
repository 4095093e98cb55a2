package io.vaultkit.client.api.token;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/token/lookup-accessor", response = LookupTokenResponse.class)
public record LookupTokenAccessorRequest(String accessor) implements LookupTokenAccessorRequestEndpoint {
}
