package io.vaultkit.client.api.kv1;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Lists the keys below a path. Folders end with {@code /}.
 */
@VaultEndpoint(path = "{self.mount}/{self.path}", method = "LIST", response = ListSecretsResponse.class)
public record ListSecretsRequest(String mount, String path) implements ListSecretsRequestEndpoint {
}
