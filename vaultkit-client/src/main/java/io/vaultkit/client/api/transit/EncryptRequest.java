package io.vaultkit.client.api.transit;

import io.vaultkit.endpoint.VaultEndpoint;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encrypts data with a named key.
 *
 * @param mount      the engine mount
 * @param name       the key name
 * @param plaintext  base64-encoded plaintext
 * @param context    base64-encoded derivation context, required for derived keys
 * @param keyVersion key version to encrypt with, or null for the latest
 */
@VaultEndpoint(path = "{self.mount}/encrypt/{self.name}", response = EncryptResponse.class)
public record EncryptRequest(
        String mount,
        String name,
        String plaintext,
        String context,
        Integer keyVersion) implements EncryptRequestEndpoint {

    /**
     * Encrypts UTF-8 text with the latest key version.
     */
    public static EncryptRequest of(String mount, String name, String text) {
        String encoded = Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
        return new EncryptRequest(mount, name, encoded, null, null);
    }
}
