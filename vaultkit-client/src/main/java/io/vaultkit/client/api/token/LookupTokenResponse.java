package io.vaultkit.client.api.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Token properties as returned by the lookup endpoints.
 *
 * @param id           the token itself; empty when looked up by accessor
 * @param accessor     the token accessor
 * @param policies     attached policies
 * @param ttl          remaining TTL in seconds
 * @param creationTtl  TTL at creation in seconds
 * @param expireTime   RFC 3339 expiry, null for non-expiring tokens
 * @param meta         token metadata
 * @param path         the path the token was created on, e.g. {@code auth/approle/login}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LookupTokenResponse(
        @JsonProperty("id") String id,
        @JsonProperty("accessor") String accessor,
        @JsonProperty("policies") List<String> policies,
        @JsonProperty("ttl") long ttl,
        @JsonProperty("creation_ttl") long creationTtl,
        @JsonProperty("creation_time") long creationTime,
        @JsonProperty("expire_time") String expireTime,
        @JsonProperty("explicit_max_ttl") long explicitMaxTtl,
        @JsonProperty("issue_time") String issueTime,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("meta") Map<String, String> meta,
        @JsonProperty("num_uses") int numUses,
        @JsonProperty("orphan") boolean orphan,
        @JsonProperty("path") String path,
        @JsonProperty("renewable") boolean renewable,
        @JsonProperty("type") String type) {

    @Override
    public String toString() {
        return "LookupTokenResponse{accessor='" + accessor + "', policies=" + policies + ", ttl=" + ttl
                + ", displayName='" + displayName + "', path='" + path + "', type='" + type + "'}";
    }
}
