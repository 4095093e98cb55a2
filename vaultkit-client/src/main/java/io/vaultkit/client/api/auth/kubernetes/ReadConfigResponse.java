package io.vaultkit.client.api.auth.kubernetes;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadConfigResponse(
        @JsonProperty("kubernetes_host") String kubernetesHost,
        @JsonProperty("kubernetes_ca_cert") String kubernetesCaCert,
        @JsonProperty("issuer") String issuer,
        @JsonProperty("disable_iss_validation") boolean disableIssValidation) {
}
