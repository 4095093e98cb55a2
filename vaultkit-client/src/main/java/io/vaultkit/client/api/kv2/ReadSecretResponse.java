package io.vaultkit.client.api.kv2;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * A secret version. {@code data} is null when the version was deleted or destroyed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadSecretResponse(
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("metadata") SecretVersionMetadata metadata) {
}
