package io.vaultkit.client.api.kv2;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "{self.mount}/metadata/{self.path}", response = SecretMetadataResponse.class)
public record ReadSecretMetadataRequest(String mount, String path) implements ReadSecretMetadataRequestEndpoint {
}
