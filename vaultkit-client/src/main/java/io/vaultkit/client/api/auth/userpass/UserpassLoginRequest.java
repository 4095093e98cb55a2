package io.vaultkit.client.api.auth.userpass;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/login/{self.username}", method = "POST")
public record UserpassLoginRequest(String mount, String username, String password)
        implements UserpassLoginRequestEndpoint {

    @Override
    public String toString() {
        return "UserpassLoginRequest[mount=" + mount + ", username=" + username + ", password=***]";
    }
}
