/**
 * Key/value secrets engine, version 2.
 *
 * <p>Secret data lives under {@code <mount>/data/<path>} and is versioned; metadata,
 * soft deletion and destruction of individual versions have their own sub-paths. Writes
 * may use check-and-set through {@link io.vaultkit.client.api.kv2.SetSecretOptions}.
 */
package io.vaultkit.client.api.kv2;
