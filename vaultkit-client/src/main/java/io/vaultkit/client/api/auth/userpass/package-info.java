/**
 * Userpass auth method: username and password stored in Vault.
 */
package io.vaultkit.client.api.auth.userpass;
