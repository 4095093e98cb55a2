package io.vaultkit.client.api.auth.kubernetes;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Configures access to the Kubernetes API used to review service account tokens.
 *
 * @param kubernetesHost       URL of the Kubernetes API server
 * @param kubernetesCaCert     PEM CA certificate of the API server
 * @param tokenReviewerJwt     JWT used for the TokenReview API; Vault's own token when null
 * @param issuer               expected {@code iss} claim
 * @param disableIssValidation skip validation of the {@code iss} claim
 */
@VaultEndpoint(path = "auth/{self.mount}/config", method = "POST", builder = true)
public record SetConfigRequest(
        String mount,
        String kubernetesHost,
        String kubernetesCaCert,
        String tokenReviewerJwt,
        String issuer,
        Boolean disableIssValidation) implements SetConfigRequestEndpoint {
}
