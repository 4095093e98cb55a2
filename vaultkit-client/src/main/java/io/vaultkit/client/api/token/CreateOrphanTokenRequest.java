package io.vaultkit.client.api.token;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;
import java.util.Map;

/**
 * Creates a token without a parent, so it outlives the calling token.
 */
@VaultEndpoint(path = "auth/token/create-orphan", builder = true)
public record CreateOrphanTokenRequest(
        String id,
        List<String> policies,
        Map<String, String> meta,
        Boolean noDefaultPolicy,
        Boolean renewable,
        String ttl,
        String type,
        @JsonProperty("explicit_max_ttl") String explicitMaxTtl,
        String displayName,
        Integer numUses,
        String period) implements CreateOrphanTokenRequestEndpoint {
}
