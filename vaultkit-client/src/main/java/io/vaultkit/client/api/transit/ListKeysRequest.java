package io.vaultkit.client.api.transit;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "{self.mount}/keys", method = "LIST", response = ListKeysResponse.class)
public record ListKeysRequest(String mount) implements ListKeysRequestEndpoint {
}
