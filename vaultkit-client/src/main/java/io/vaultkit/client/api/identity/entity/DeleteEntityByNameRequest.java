package io.vaultkit.client.api.identity.entity;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "identity/entity/name/{self.name}", method = "DELETE")
public record DeleteEntityByNameRequest(String name) implements DeleteEntityByNameRequestEndpoint {
}
