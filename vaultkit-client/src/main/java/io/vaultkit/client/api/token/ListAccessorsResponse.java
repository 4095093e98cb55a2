package io.vaultkit.client.api.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ListAccessorsResponse(@JsonProperty("keys") List<String> keys) {
}
