package io.vaultkit.client.api.auth.userpass;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/users", method = "LIST", response = ListUsersResponse.class)
public record ListUsersRequest(String mount) implements ListUsersRequestEndpoint {
}
