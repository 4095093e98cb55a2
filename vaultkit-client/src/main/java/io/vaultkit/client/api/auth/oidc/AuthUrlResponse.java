package io.vaultkit.client.api.auth.oidc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param authUrl the provider URL; empty when the role or redirect URI is not allowed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthUrlResponse(@JsonProperty("auth_url") String authUrl) {
}
