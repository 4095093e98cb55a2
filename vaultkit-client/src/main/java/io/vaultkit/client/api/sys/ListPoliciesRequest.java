package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "sys/policies/acl", method = "LIST", response = ListPoliciesResponse.class)
public record ListPoliciesRequest() implements ListPoliciesRequestEndpoint {
}
