package io.vaultkit.client.api.kv2;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "{self.mount}/metadata/{self.path}", method = "LIST", response = ListSecretsResponse.class)
public record ListSecretsRequest(String mount, String path) implements ListSecretsRequestEndpoint {
}
