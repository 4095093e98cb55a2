package io.vaultkit.client.api.kv2;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Soft-deletes the latest version of a secret.
 */
@VaultEndpoint(path = "{self.mount}/data/{self.path}", method = "DELETE")
public record DeleteLatestSecretVersionRequest(String mount, String path)
        implements DeleteLatestSecretVersionRequestEndpoint {
}
