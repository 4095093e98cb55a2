package io.vaultkit.client.api.auth.userpass;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/users/{self.username}", response = ReadUserResponse.class)
public record ReadUserRequest(String mount, String username) implements ReadUserRequestEndpoint {
}
