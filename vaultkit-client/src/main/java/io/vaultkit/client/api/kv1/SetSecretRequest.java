package io.vaultkit.client.api.kv1;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.Map;

/**
 * Writes a secret, replacing any previous value at the path.
 *
 * @param mount the engine mount, e.g. {@code secret}
 * @param path  the secret path below the mount
 * @param data  the secret; sent as the whole request body
 */
@VaultEndpoint(path = "{self.mount}/{self.path}", method = "POST")
public record SetSecretRequest(
        String mount,
        String path,
        @VaultEndpoint.Body Map<String, Object> data) implements SetSecretRequestEndpoint {
}
