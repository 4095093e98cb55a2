package io.vaultkit.client.api.auth.approle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ListRolesResponse(@JsonProperty("keys") List<String> keys) {
}
