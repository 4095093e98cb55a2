package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "sys/policies/acl/{self.name}", response = ReadPolicyResponse.class)
public record ReadPolicyRequest(String name) implements ReadPolicyRequestEndpoint {
}
