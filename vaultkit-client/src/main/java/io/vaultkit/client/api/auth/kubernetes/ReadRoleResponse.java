package io.vaultkit.client.api.auth.kubernetes;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadRoleResponse(
        @JsonProperty("bound_service_account_names") List<String> boundServiceAccountNames,
        @JsonProperty("bound_service_account_namespaces") List<String> boundServiceAccountNamespaces,
        @JsonProperty("audience") String audience,
        @JsonProperty("token_policies") List<String> tokenPolicies,
        @JsonProperty("token_ttl") long tokenTtl,
        @JsonProperty("token_max_ttl") long tokenMaxTtl) {
}
