package io.vaultkit.client.api.kv1;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "{self.mount}/{self.path}", method = "DELETE")
public record DeleteSecretRequest(String mount, String path) implements DeleteSecretRequestEndpoint {
}
