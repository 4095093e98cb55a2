package io.vaultkit.client.api.token;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/token/renew-self")
public record RenewSelfTokenRequest(String increment) implements RenewSelfTokenRequestEndpoint {
}
