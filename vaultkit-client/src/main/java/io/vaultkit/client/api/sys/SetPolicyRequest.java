package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Creates or replaces an ACL policy.
 */
@VaultEndpoint(path = "sys/policies/acl/{self.name}")
public record SetPolicyRequest(String name, String policy) implements SetPolicyRequestEndpoint {
}
