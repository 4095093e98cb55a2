package io.vaultkit.client.api.auth.oidc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadRoleResponse(
        @JsonProperty("role_type") String roleType,
        @JsonProperty("user_claim") String userClaim,
        @JsonProperty("allowed_redirect_uris") List<String> allowedRedirectUris,
        @JsonProperty("bound_audiences") List<String> boundAudiences,
        @JsonProperty("bound_subject") String boundSubject,
        @JsonProperty("bound_claims") Map<String, Object> boundClaims,
        @JsonProperty("groups_claim") String groupsClaim,
        @JsonProperty("oidc_scopes") List<String> oidcScopes,
        @JsonProperty("token_policies") List<String> tokenPolicies,
        @JsonProperty("token_ttl") long tokenTtl) {
}
