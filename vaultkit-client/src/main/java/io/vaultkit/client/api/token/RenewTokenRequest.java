package io.vaultkit.client.api.token;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Renews a token. The renewed lease is in the envelope's {@code auth} block.
 *
 * @param token     the token to renew
 * @param increment requested extension, e.g. {@code 1h}; null keeps the token's TTL
 */
@VaultEndpoint(path = "auth/token/renew")
public record RenewTokenRequest(String token, String increment) implements RenewTokenRequestEndpoint {
}
