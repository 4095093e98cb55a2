package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Reads the seal status. The response is not enveloped, use {@code VaultClient#executeRaw}.
 */
@VaultEndpoint(path = "sys/seal-status", response = SealStatusResponse.class)
public record ReadSealStatusRequest() implements ReadSealStatusRequestEndpoint {
}
