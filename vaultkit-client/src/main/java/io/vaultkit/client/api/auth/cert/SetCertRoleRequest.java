package io.vaultkit.client.api.auth.cert;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;

/**
 * Creates or updates a certificate role.
 *
 * @param certificate        PEM CA certificate that client certificates must chain to
 * @param allowedCommonNames accepted subject common names; any when null
 */
@VaultEndpoint(path = "auth/{self.mount}/certs/{self.name}", method = "POST", builder = true)
public record SetCertRoleRequest(
        String mount,
        String name,
        String certificate,
        List<String> allowedCommonNames,
        String displayName,
        List<String> tokenPolicies,
        String tokenTtl) implements SetCertRoleRequestEndpoint {
}
