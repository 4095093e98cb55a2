package io.vaultkit.client.api.token;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;
import java.util.Map;

/**
 * Creates a child token of the calling token. The new token is returned in the
 * envelope's {@code auth} block, use {@code VaultClient#auth}.
 */
@VaultEndpoint(path = "auth/token/create", builder = true)
public record CreateTokenRequest(
        String id,
        List<String> policies,
        Map<String, String> meta,
        Boolean noParent,
        Boolean noDefaultPolicy,
        Boolean renewable,
        String ttl,
        String type,
        @JsonProperty("explicit_max_ttl") String explicitMaxTtl,
        String displayName,
        Integer numUses,
        String period,
        String entityAlias) implements CreateTokenRequestEndpoint {
}
