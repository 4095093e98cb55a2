package io.vaultkit.client.api.kv2;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Configures engine-wide defaults.
 *
 * @param mount              the engine mount
 * @param maxVersions        versions kept per secret; 0 keeps Vault's default of 10
 * @param casRequired        require check-and-set on every write
 * @param deleteVersionAfter soft-delete versions after this duration, e.g. {@code 720h}
 */
@VaultEndpoint(path = "{self.mount}/config", method = "POST", builder = true)
public record SetConfigRequest(
        String mount,
        Integer maxVersions,
        Boolean casRequired,
        String deleteVersionAfter) implements SetConfigRequestEndpoint {
}
