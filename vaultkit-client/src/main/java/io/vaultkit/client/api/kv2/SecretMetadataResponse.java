package io.vaultkit.client.api.kv2;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Metadata of a secret across all of its versions.
 *
 * @param versions version number (as a string) to version metadata
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SecretMetadataResponse(
        @JsonProperty("cas_required") boolean casRequired,
        @JsonProperty("created_time") String createdTime,
        @JsonProperty("current_version") int currentVersion,
        @JsonProperty("custom_metadata") Map<String, String> customMetadata,
        @JsonProperty("delete_version_after") String deleteVersionAfter,
        @JsonProperty("max_versions") int maxVersions,
        @JsonProperty("oldest_version") int oldestVersion,
        @JsonProperty("updated_time") String updatedTime,
        @JsonProperty("versions") Map<String, SecretVersionMetadata> versions) {
}
