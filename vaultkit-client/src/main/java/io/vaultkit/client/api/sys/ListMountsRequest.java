package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Lists the enabled secrets engines, keyed by mount path.
 */
@VaultEndpoint(path = "sys/mounts", response = MountsResponse.class)
public record ListMountsRequest() implements ListMountsRequestEndpoint {
}
