package io.vaultkit.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The {@code wrap_info} block of a wrapped response.
 *
 * @param token           the single-use wrapping token
 * @param accessor        the wrapping token's accessor
 * @param ttl             seconds until the wrapping token expires
 * @param creationTime    RFC 3339 creation timestamp
 * @param creationPath    the API path whose response was wrapped
 * @param wrappedAccessor accessor of a wrapped token, when the payload is a token
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WrapInfo(
        @JsonProperty("token") String token,
        @JsonProperty("accessor") String accessor,
        @JsonProperty("ttl") long ttl,
        @JsonProperty("creation_time") String creationTime,
        @JsonProperty("creation_path") String creationPath,
        @JsonProperty("wrapped_accessor") String wrappedAccessor) {

    @Override
    public String toString() {
        return "WrapInfo{accessor='" + accessor + "', ttl=" + ttl + ", creationTime='" + creationTime
                + "', creationPath='" + creationPath + "'}";
    }
}
