package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Reads a wrapping token's metadata without consuming it.
 */
@VaultEndpoint(path = "sys/wrapping/lookup", response = WrappingLookupResponse.class)
public record WrappingLookupRequest(String token) implements WrappingLookupRequestEndpoint {
}
