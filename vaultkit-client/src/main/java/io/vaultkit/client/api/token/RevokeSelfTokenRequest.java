package io.vaultkit.client.api.token;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/token/revoke-self", method = "POST")
public record RevokeSelfTokenRequest() implements RevokeSelfTokenRequestEndpoint {
}
