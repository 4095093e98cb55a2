package io.vaultkit.client.api.identity.entity;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "identity/entity/name/{self.name}", response = ReadEntityResponse.class)
public record ReadEntityByNameRequest(String name) implements ReadEntityByNameRequestEndpoint {
}
