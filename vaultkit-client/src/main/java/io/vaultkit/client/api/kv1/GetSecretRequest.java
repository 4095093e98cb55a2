package io.vaultkit.client.api.kv1;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "{self.mount}/{self.path}", response = GetSecretResponse.class)
public record GetSecretRequest(String mount, String path) implements GetSecretRequestEndpoint {
}
