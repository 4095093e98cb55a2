package io.vaultkit.client.api.auth.userpass;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadUserResponse(
        @JsonProperty("token_policies") List<String> tokenPolicies,
        @JsonProperty("token_ttl") long tokenTtl,
        @JsonProperty("token_max_ttl") long tokenMaxTtl,
        @JsonProperty("token_type") String tokenType) {
}
