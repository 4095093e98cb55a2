package io.vaultkit.client.api.kv2;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Reads a secret version.
 *
 * @param mount   the engine mount
 * @param path    the secret path below the mount
 * @param version the version to read, or null for the latest
 */
@VaultEndpoint(path = "{self.mount}/data/{self.path}", response = ReadSecretResponse.class)
public record ReadSecretRequest(
        String mount,
        String path,
        @VaultEndpoint.Query Integer version) implements ReadSecretRequestEndpoint {

    public ReadSecretRequest(String mount, String path) {
        this(mount, path, null);
    }
}
