package io.vaultkit.client.api.transit;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Creates a named encryption key.
 *
 * @param mount                the engine mount, e.g. {@code transit}
 * @param name                 the key name
 * @param type                 key type, {@code aes256-gcm96} when null
 * @param exportable           allow the key to be exported
 * @param allowPlaintextBackup allow plaintext backups of the key
 * @param derived              enable key derivation; requires a context on every operation
 * @param convergentEncryption deterministic encryption for the same plaintext and context
 * @param autoRotatePeriod     rotate automatically after this duration, e.g. {@code 720h}
 */
@VaultEndpoint(path = "{self.mount}/keys/{self.name}", method = "POST", builder = true)
public record CreateKeyRequest(
        String mount,
        String name,
        String type,
        Boolean exportable,
        Boolean allowPlaintextBackup,
        Boolean derived,
        Boolean convergentEncryption,
        String autoRotatePeriod) implements CreateKeyRequestEndpoint {
}
