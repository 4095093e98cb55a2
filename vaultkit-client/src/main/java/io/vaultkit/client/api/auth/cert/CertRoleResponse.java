package io.vaultkit.client.api.auth.cert;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CertRoleResponse(
        @JsonProperty("certificate") String certificate,
        @JsonProperty("allowed_common_names") List<String> allowedCommonNames,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("token_policies") List<String> tokenPolicies,
        @JsonProperty("token_ttl") long tokenTtl) {
}
