package io.vaultkit.client.api.auth.approle;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/role/{self.roleName}", response = ReadRoleResponse.class)
public record ReadRoleRequest(String mount, String roleName) implements ReadRoleRequestEndpoint {
}
