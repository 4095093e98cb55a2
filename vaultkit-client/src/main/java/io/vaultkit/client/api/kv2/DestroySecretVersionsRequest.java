package io.vaultkit.client.api.kv2;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;

/**
 * Permanently removes the data of the given versions.
 */
@VaultEndpoint(path = "{self.mount}/destroy/{self.path}", method = "PUT")
public record DestroySecretVersionsRequest(String mount, String path, List<Integer> versions)
        implements DestroySecretVersionsRequestEndpoint {
}
