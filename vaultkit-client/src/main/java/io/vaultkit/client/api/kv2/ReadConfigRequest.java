package io.vaultkit.client.api.kv2;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "{self.mount}/config", response = ReadConfigResponse.class)
public record ReadConfigRequest(String mount) implements ReadConfigRequestEndpoint {
}
