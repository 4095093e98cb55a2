package io.vaultkit.client.api.identity.entity;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "identity/entity/id/{self.id}", response = ReadEntityResponse.class)
public record ReadEntityByIdRequest(String id) implements ReadEntityByIdRequestEndpoint {
}
