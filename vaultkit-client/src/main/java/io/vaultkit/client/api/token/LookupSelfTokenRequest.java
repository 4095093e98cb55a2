package io.vaultkit.client.api.token;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Looks up the token the request is sent with.
 */
@VaultEndpoint(path = "auth/token/lookup-self", response = LookupTokenResponse.class)
public record LookupSelfTokenRequest() implements LookupSelfTokenRequestEndpoint {
}
