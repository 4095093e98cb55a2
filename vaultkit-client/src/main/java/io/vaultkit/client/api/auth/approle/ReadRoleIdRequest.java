package io.vaultkit.client.api.auth.approle;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/role/{self.roleName}/role-id", response = RoleIdResponse.class)
public record ReadRoleIdRequest(String mount, String roleName) implements ReadRoleIdRequestEndpoint {
}
