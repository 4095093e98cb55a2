package io.vaultkit.client.api.transit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ListKeysResponse(@JsonProperty("keys") List<String> keys) {
}
