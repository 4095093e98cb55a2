package io.vaultkit.client.api.kv2;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;

/**
 * Restores soft-deleted versions.
 */
@VaultEndpoint(path = "{self.mount}/undelete/{self.path}", method = "POST")
public record UndeleteSecretVersionsRequest(String mount, String path, List<Integer> versions)
        implements UndeleteSecretVersionsRequestEndpoint {
}
