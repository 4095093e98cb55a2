package io.vaultkit.client.api.sys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Seal status of a Vault server.
 *
 * @param type        the seal type, e.g. {@code shamir}
 * @param initialized whether the server has been initialised
 * @param sealed      whether the server is sealed
 * @param threshold   unseal keys required
 * @param shares      unseal keys issued
 * @param progress    unseal keys provided so far
 * @param version     server version
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SealStatusResponse(
        @JsonProperty("type") String type,
        @JsonProperty("initialized") boolean initialized,
        @JsonProperty("sealed") boolean sealed,
        @JsonProperty("t") int threshold,
        @JsonProperty("n") int shares,
        @JsonProperty("progress") int progress,
        @JsonProperty("nonce") String nonce,
        @JsonProperty("version") String version,
        @JsonProperty("build_date") String buildDate,
        @JsonProperty("migration") boolean migration,
        @JsonProperty("cluster_name") String clusterName,
        @JsonProperty("cluster_id") String clusterId,
        @JsonProperty("recovery_seal") boolean recoverySeal,
        @JsonProperty("storage_type") String storageType) {
}
