/**
 * Transit secrets engine: encryption as a service.
 *
 * <p>Plaintext sent to and returned from Vault is base64-encoded; ciphertext has the form
 * {@code vault:v<key version>:<base64>}. {@link io.vaultkit.client.api.transit.EncryptRequest#of}
 * and {@link io.vaultkit.client.api.transit.DecryptResponse#plaintextString()} handle the
 * encoding for text.
 */
package io.vaultkit.client.api.transit;
