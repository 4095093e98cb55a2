package io.vaultkit.client.api.transit;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Decrypts ciphertext produced by {@link EncryptRequest}.
 *
 * @param mount      the engine mount
 * @param name       the key name
 * @param ciphertext ciphertext of the form {@code vault:v1:...}
 * @param context    base64-encoded derivation context, required for derived keys
 */
@VaultEndpoint(path = "{self.mount}/decrypt/{self.name}", response = DecryptResponse.class)
public record DecryptRequest(
        String mount,
        String name,
        String ciphertext,
        String context) implements DecryptRequestEndpoint {

    public DecryptRequest(String mount, String name, String ciphertext) {
        this(mount, name, ciphertext, null);
    }
}
