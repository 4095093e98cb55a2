/**
 * AppRole auth method: machine login with a role id and a secret id.
 */
package io.vaultkit.client.api.auth.approle;
