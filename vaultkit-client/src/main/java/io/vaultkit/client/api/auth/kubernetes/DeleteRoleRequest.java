package io.vaultkit.client.api.auth.kubernetes;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/role/{self.name}", method = "DELETE")
public record DeleteRoleRequest(String mount, String name) implements DeleteRoleRequestEndpoint {
}
