package io.vaultkit.client.api.kv2;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Metadata of one secret version.
 *
 * @param createdTime    RFC 3339 creation timestamp
 * @param customMetadata user-supplied metadata of the secret
 * @param deletionTime   RFC 3339 soft-deletion timestamp, empty when not deleted
 * @param destroyed      whether the version data has been destroyed
 * @param version        the version number; 0 inside a metadata listing
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SecretVersionMetadata(
        @JsonProperty("created_time") String createdTime,
        @JsonProperty("custom_metadata") Map<String, String> customMetadata,
        @JsonProperty("deletion_time") String deletionTime,
        @JsonProperty("destroyed") boolean destroyed,
        @JsonProperty("version") int version) {
}
