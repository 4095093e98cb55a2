package io.vaultkit.client.api.transit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EncryptResponse(
        @JsonProperty("ciphertext") String ciphertext,
        @JsonProperty("key_version") int keyVersion) {
}
