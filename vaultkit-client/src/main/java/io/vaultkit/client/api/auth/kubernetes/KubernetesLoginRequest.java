package io.vaultkit.client.api.auth.kubernetes;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/login", method = "POST")
public record KubernetesLoginRequest(String mount, String role, String jwt)
        implements KubernetesLoginRequestEndpoint {

    @Override
    public String toString() {
        return "KubernetesLoginRequest[mount=" + mount + ", role=" + role + ", jwt=***]";
    }
}
