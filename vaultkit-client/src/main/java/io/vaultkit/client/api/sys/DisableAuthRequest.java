package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "sys/auth/{self.path}", method = "DELETE")
public record DisableAuthRequest(String path) implements DisableAuthRequestEndpoint {
}
