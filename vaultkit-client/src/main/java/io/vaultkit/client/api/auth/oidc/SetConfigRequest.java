package io.vaultkit.client.api.auth.oidc;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;

/**
 * Configures the provider. Use either OIDC discovery, a JWKS URL or static public keys.
 */
@VaultEndpoint(path = "auth/{self.mount}/config", method = "POST", builder = true)
public record SetConfigRequest(
        String mount,
        String oidcDiscoveryUrl,
        String oidcDiscoveryCaPem,
        String oidcClientId,
        String oidcClientSecret,
        String jwksUrl,
        List<String> jwtValidationPubkeys,
        List<String> jwtSupportedAlgs,
        String boundIssuer,
        String defaultRole) implements SetConfigRequestEndpoint {

    @Override
    public String toString() {
        return "SetConfigRequest[mount=" + mount + ", oidcDiscoveryUrl=" + oidcDiscoveryUrl + ", oidcClientId="
                + oidcClientId + ", oidcClientSecret=***, jwksUrl=" + jwksUrl + ", defaultRole=" + defaultRole + "]";
    }
}
