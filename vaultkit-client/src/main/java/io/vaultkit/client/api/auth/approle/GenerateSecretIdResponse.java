package io.vaultkit.client.api.auth.approle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerateSecretIdResponse(
        @JsonProperty("secret_id") String secretId,
        @JsonProperty("secret_id_accessor") String secretIdAccessor,
        @JsonProperty("secret_id_ttl") long secretIdTtl,
        @JsonProperty("secret_id_num_uses") int secretIdNumUses) {

    @Override
    public String toString() {
        return "GenerateSecretIdResponse[secretId=***, secretIdAccessor=" + secretIdAccessor
                + ", secretIdTtl=" + secretIdTtl + ", secretIdNumUses=" + secretIdNumUses + "]";
    }
}
