package io.vaultkit.client.api.auth.approle;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/role/{self.roleName}", method = "DELETE")
public record DeleteRoleRequest(String mount, String roleName) implements DeleteRoleRequestEndpoint {
}
