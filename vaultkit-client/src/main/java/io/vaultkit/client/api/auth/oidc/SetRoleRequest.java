package io.vaultkit.client.api.auth.oidc;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;
import java.util.Map;

/**
 * Creates or updates a JWT/OIDC role.
 *
 * @param roleType            {@code oidc} for the browser flow, {@code jwt} for direct JWT login
 * @param userClaim           claim used as the entity alias name, e.g. {@code sub}
 * @param allowedRedirectUris redirect URIs accepted by {@link AuthUrlRequest}
 * @param boundClaims         claims the token must carry, with required values
 */
@VaultEndpoint(path = "auth/{self.mount}/role/{self.name}", method = "POST", builder = true)
public record SetRoleRequest(
        String mount,
        String name,
        String roleType,
        String userClaim,
        List<String> allowedRedirectUris,
        List<String> boundAudiences,
        String boundSubject,
        Map<String, Object> boundClaims,
        String groupsClaim,
        List<String> oidcScopes,
        List<String> tokenPolicies,
        String tokenTtl) implements SetRoleRequestEndpoint {
}
