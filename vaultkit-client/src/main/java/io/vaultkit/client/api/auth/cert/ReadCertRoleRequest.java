package io.vaultkit.client.api.auth.cert;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/certs/{self.name}", response = CertRoleResponse.class)
public record ReadCertRoleRequest(String mount, String name) implements ReadCertRoleRequestEndpoint {
}
