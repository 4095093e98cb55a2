package io.vaultkit.client.api.auth.approle;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;

/**
 * Creates or updates an AppRole role.
 */
@VaultEndpoint(path = "auth/{self.mount}/role/{self.roleName}", method = "POST", builder = true)
public record SetRoleRequest(
        String mount,
        String roleName,
        Boolean bindSecretId,
        List<String> secretIdBoundCidrs,
        Integer secretIdNumUses,
        String secretIdTtl,
        List<String> tokenPolicies,
        String tokenTtl,
        String tokenMaxTtl,
        List<String> tokenBoundCidrs,
        String tokenType) implements SetRoleRequestEndpoint {
}
