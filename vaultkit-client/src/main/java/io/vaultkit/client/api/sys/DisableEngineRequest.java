package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "sys/mounts/{self.path}", method = "DELETE")
public record DisableEngineRequest(String path) implements DisableEngineRequestEndpoint {
}
