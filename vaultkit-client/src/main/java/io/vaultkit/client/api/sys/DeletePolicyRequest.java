package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "sys/policies/acl/{self.name}", method = "DELETE")
public record DeletePolicyRequest(String name) implements DeletePolicyRequestEndpoint {
}
