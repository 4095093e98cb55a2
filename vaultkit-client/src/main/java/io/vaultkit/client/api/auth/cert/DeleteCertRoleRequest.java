package io.vaultkit.client.api.auth.cert;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/certs/{self.name}", method = "DELETE")
public record DeleteCertRoleRequest(String mount, String name) implements DeleteCertRoleRequestEndpoint {
}
