package io.vaultkit.client.api.transit;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Adds a new version of the key. New encryptions use it; older ciphertext stays decryptable
 * down to the key's minimum decryption version.
 */
@VaultEndpoint(path = "{self.mount}/keys/{self.name}/rotate", method = "POST")
public record RotateKeyRequest(String mount, String name) implements RotateKeyRequestEndpoint {
}
