package io.vaultkit.client.api.kv2;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;

/**
 * Soft-deletes the given versions. Their data can be restored with {@link UndeleteSecretVersionsRequest}.
 */
@VaultEndpoint(path = "{self.mount}/delete/{self.path}", method = "POST")
public record DeleteSecretVersionsRequest(String mount, String path, List<Integer> versions)
        implements DeleteSecretVersionsRequestEndpoint {
}
