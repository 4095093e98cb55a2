package io.vaultkit.client.api.auth.kubernetes;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;

/**
 * Binds service accounts to Vault policies.
 */
@VaultEndpoint(path = "auth/{self.mount}/role/{self.name}", method = "POST", builder = true)
public record SetRoleRequest(
        String mount,
        String name,
        List<String> boundServiceAccountNames,
        List<String> boundServiceAccountNamespaces,
        String audience,
        List<String> tokenPolicies,
        String tokenTtl,
        String tokenMaxTtl) implements SetRoleRequestEndpoint {
}
