package io.vaultkit.client.api.token;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Lists the accessors of all tokens. Requires sudo.
 */
@VaultEndpoint(path = "auth/token/accessors", method = "LIST", response = ListAccessorsResponse.class)
public record ListAccessorsRequest() implements ListAccessorsRequestEndpoint {
}
