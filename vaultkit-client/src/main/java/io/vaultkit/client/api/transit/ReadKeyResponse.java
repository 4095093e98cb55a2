package io.vaultkit.client.api.transit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Properties of a transit key. For symmetric keys {@code keys} maps each version to its
 * creation time in epoch seconds; for asymmetric keys it maps to the public key details.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadKeyResponse(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("keys") Map<String, Object> keys,
        @JsonProperty("latest_version") int latestVersion,
        @JsonProperty("min_decryption_version") int minDecryptionVersion,
        @JsonProperty("min_encryption_version") int minEncryptionVersion,
        @JsonProperty("deletion_allowed") boolean deletionAllowed,
        @JsonProperty("derived") boolean derived,
        @JsonProperty("exportable") boolean exportable,
        @JsonProperty("allow_plaintext_backup") boolean allowPlaintextBackup,
        @JsonProperty("supports_encryption") boolean supportsEncryption,
        @JsonProperty("supports_decryption") boolean supportsDecryption,
        @JsonProperty("supports_derivation") boolean supportsDerivation,
        @JsonProperty("supports_signing") boolean supportsSigning,
        @JsonProperty("auto_rotate_period") long autoRotatePeriod) {
}
