package io.vaultkit.client.api.auth.userpass;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/users/{self.username}/password", method = "POST")
public record UpdatePasswordRequest(String mount, String username, String password)
        implements UpdatePasswordRequestEndpoint {

    @Override
    public String toString() {
        return "UpdatePasswordRequest[mount=" + mount + ", username=" + username + ", password=***]";
    }
}
