package io.vaultkit.client.api.auth.userpass;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ListUsersResponse(@JsonProperty("keys") List<String> keys) {
}
