/**
 * TLS certificate auth method. Login is authenticated by the client certificate
 * configured with {@code VaultClientSettings.Builder#identity}.
 */
package io.vaultkit.client.api.auth.cert;
