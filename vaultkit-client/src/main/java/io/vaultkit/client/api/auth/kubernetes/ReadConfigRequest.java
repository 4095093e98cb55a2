package io.vaultkit.client.api.auth.kubernetes;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/config", response = ReadConfigResponse.class)
public record ReadConfigRequest(String mount) implements ReadConfigRequestEndpoint {
}
