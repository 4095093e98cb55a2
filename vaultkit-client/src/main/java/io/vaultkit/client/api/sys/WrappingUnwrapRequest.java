package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Exchanges a wrapping token for the wrapped payload. The token is consumed.
 * The payload type is chosen by the caller, see {@code VaultClient#unwrap}.
 */
@VaultEndpoint(path = "sys/wrapping/unwrap", method = "POST")
public record WrappingUnwrapRequest(String token) implements WrappingUnwrapRequestEndpoint {
}
