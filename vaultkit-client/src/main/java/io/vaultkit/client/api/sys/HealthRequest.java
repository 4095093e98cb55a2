package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Reads server health. The response is not enveloped, use {@code VaultClient#executeRaw}.
 *
 * @param standbyOk     report a standby node as healthy (200) instead of 429
 * @param perfStandbyOk report a performance standby as healthy instead of 473
 */
@VaultEndpoint(path = "sys/health", response = HealthResponse.class)
public record HealthRequest(
        @VaultEndpoint.Query("standbyok") Boolean standbyOk,
        @VaultEndpoint.Query("perfstandbyok") Boolean perfStandbyOk) implements HealthRequestEndpoint {
}
