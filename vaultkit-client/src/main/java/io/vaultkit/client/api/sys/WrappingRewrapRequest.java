package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Moves a wrapped payload to a new wrapping token, invalidating the old one.
 * The new token is returned in the envelope's {@code wrap_info}.
 */
@VaultEndpoint(path = "sys/wrapping/rewrap")
public record WrappingRewrapRequest(String token) implements WrappingRewrapRequestEndpoint {
}
