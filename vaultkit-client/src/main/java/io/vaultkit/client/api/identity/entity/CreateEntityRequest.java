package io.vaultkit.client.api.identity.entity;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;
import java.util.Map;

/**
 * Creates an entity, or updates it when {@code id} names an existing one. Updates return
 * no content, so execute updates with {@code VaultClient#executeEmpty}.
 */
@VaultEndpoint(path = "identity/entity", method = "POST", response = CreateEntityResponse.class, builder = true)
public record CreateEntityRequest(
        String name,
        String id,
        Map<String, String> metadata,
        List<String> policies,
        Boolean disabled) implements CreateEntityRequestEndpoint {
}
