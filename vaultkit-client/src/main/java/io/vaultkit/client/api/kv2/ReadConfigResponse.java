package io.vaultkit.client.api.kv2;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadConfigResponse(
        @JsonProperty("max_versions") int maxVersions,
        @JsonProperty("cas_required") boolean casRequired,
        @JsonProperty("delete_version_after") String deleteVersionAfter) {
}
