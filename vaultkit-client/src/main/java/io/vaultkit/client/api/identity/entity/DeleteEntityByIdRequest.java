package io.vaultkit.client.api.identity.entity;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "identity/entity/id/{self.id}", method = "DELETE")
public record DeleteEntityByIdRequest(String id) implements DeleteEntityByIdRequestEndpoint {
}
