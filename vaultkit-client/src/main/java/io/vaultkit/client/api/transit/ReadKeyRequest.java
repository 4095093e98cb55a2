package io.vaultkit.client.api.transit;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "{self.mount}/keys/{self.name}", response = ReadKeyResponse.class)
public record ReadKeyRequest(String mount, String name) implements ReadKeyRequestEndpoint {
}
