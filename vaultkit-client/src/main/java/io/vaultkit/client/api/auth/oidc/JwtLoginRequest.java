package io.vaultkit.client.api.auth.oidc;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/login", method = "POST")
public record JwtLoginRequest(String mount, String role, String jwt) implements JwtLoginRequestEndpoint {

    @Override
    public String toString() {
        return "JwtLoginRequest[mount=" + mount + ", role=" + role + ", jwt=***]";
    }
}
