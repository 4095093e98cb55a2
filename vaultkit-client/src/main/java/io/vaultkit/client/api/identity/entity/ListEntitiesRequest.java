package io.vaultkit.client.api.identity.entity;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "identity/entity/id", method = "LIST", response = ListEntitiesResponse.class)
public record ListEntitiesRequest() implements ListEntitiesRequestEndpoint {
}
