package io.vaultkit.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * The {@code auth} block of a token-issuing response, such as a login.
 *
 * @param clientToken   the issued session token
 * @param accessor      the token accessor
 * @param policies      all policies attached to the token
 * @param tokenPolicies policies attached directly to the token
 * @param metadata      auth method metadata, e.g. the role name
 * @param leaseDuration token TTL in seconds
 * @param renewable     whether the token can be renewed
 * @param entityId      identity entity the token belongs to
 * @param tokenType     {@code service} or {@code batch}
 * @param orphan        whether the token has no parent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthInfo(
        @JsonProperty("client_token") String clientToken,
        @JsonProperty("accessor") String accessor,
        @JsonProperty("policies") List<String> policies,
        @JsonProperty("token_policies") List<String> tokenPolicies,
        @JsonProperty("metadata") Map<String, String> metadata,
        @JsonProperty("lease_duration") long leaseDuration,
        @JsonProperty("renewable") boolean renewable,
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("orphan") boolean orphan) {

    @Override
    public String toString() {
        return "AuthInfo{accessor='" + accessor + "', policies=" + policies
                + ", leaseDuration=" + leaseDuration + ", renewable=" + renewable
                + ", entityId='" + entityId + "', tokenType='" + tokenType + "'}";
    }
}
