package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Lists the enabled auth methods, keyed by mount path.
 */
@VaultEndpoint(path = "sys/auth", response = AuthsResponse.class)
public record ListAuthsRequest() implements ListAuthsRequestEndpoint {
}
