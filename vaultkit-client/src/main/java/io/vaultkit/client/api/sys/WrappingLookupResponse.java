package io.vaultkit.client.api.sys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata of a live wrapping token.
 *
 * @param creationPath the API path whose response was wrapped
 * @param creationTime RFC 3339 creation timestamp
 * @param creationTtl  the wrapping TTL in seconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WrappingLookupResponse(
        @JsonProperty("creation_path") String creationPath,
        @JsonProperty("creation_time") String creationTime,
        @JsonProperty("creation_ttl") long creationTtl) {
}
