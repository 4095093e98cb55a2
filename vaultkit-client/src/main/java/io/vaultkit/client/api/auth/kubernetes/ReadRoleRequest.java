package io.vaultkit.client.api.auth.kubernetes;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/role/{self.name}", response = ReadRoleResponse.class)
public record ReadRoleRequest(String mount, String name) implements ReadRoleRequestEndpoint {
}
