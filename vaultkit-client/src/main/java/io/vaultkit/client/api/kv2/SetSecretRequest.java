package io.vaultkit.client.api.kv2;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.Map;

/**
 * Writes a new version of a secret.
 *
 * @param mount   the engine mount
 * @param path    the secret path below the mount
 * @param data    the secret
 * @param options write options, or null
 */
@VaultEndpoint(path = "{self.mount}/data/{self.path}", method = "POST", response = SecretVersionMetadata.class)
public record SetSecretRequest(
        String mount,
        String path,
        Map<String, Object> data,
        SetSecretOptions options) implements SetSecretRequestEndpoint {

    public SetSecretRequest(String mount, String path, Map<String, Object> data) {
        this(mount, path, data, null);
    }
}
