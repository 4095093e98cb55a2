package io.vaultkit.client.api.auth.userpass;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/users/{self.username}", method = "DELETE")
public record DeleteUserRequest(String mount, String username) implements DeleteUserRequestEndpoint {
}
