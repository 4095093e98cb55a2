package io.vaultkit.client.api.auth.oidc;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/role", method = "LIST", response = ListRolesResponse.class)
public record ListRolesRequest(String mount) implements ListRolesRequestEndpoint {
}
