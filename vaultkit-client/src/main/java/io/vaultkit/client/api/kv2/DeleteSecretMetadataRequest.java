package io.vaultkit.client.api.kv2;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Deletes a secret's metadata and every version of it.
 */
@VaultEndpoint(path = "{self.mount}/metadata/{self.path}", method = "DELETE")
public record DeleteSecretMetadataRequest(String mount, String path) implements DeleteSecretMetadataRequestEndpoint {
}
