package io.vaultkit.client.api.auth.oidc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadConfigResponse(
        @JsonProperty("oidc_discovery_url") String oidcDiscoveryUrl,
        @JsonProperty("oidc_client_id") String oidcClientId,
        @JsonProperty("jwks_url") String jwksUrl,
        @JsonProperty("jwt_validation_pubkeys") List<String> jwtValidationPubkeys,
        @JsonProperty("jwt_supported_algs") List<String> jwtSupportedAlgs,
        @JsonProperty("bound_issuer") String boundIssuer,
        @JsonProperty("default_role") String defaultRole) {
}
