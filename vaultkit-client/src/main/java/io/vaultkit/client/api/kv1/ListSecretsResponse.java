package io.vaultkit.client.api.kv1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ListSecretsResponse(@JsonProperty("keys") List<String> keys) {
}
