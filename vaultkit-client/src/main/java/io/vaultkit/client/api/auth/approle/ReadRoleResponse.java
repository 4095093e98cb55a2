package io.vaultkit.client.api.auth.approle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * An AppRole role. TTLs are in seconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadRoleResponse(
        @JsonProperty("bind_secret_id") boolean bindSecretId,
        @JsonProperty("secret_id_bound_cidrs") List<String> secretIdBoundCidrs,
        @JsonProperty("secret_id_num_uses") int secretIdNumUses,
        @JsonProperty("secret_id_ttl") long secretIdTtl,
        @JsonProperty("token_policies") List<String> tokenPolicies,
        @JsonProperty("token_ttl") long tokenTtl,
        @JsonProperty("token_max_ttl") long tokenMaxTtl,
        @JsonProperty("token_bound_cidrs") List<String> tokenBoundCidrs,
        @JsonProperty("token_type") String tokenType) {
}
