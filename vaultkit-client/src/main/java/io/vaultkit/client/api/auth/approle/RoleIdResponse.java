package io.vaultkit.client.api.auth.approle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RoleIdResponse(@JsonProperty("role_id") String roleId) {
}
