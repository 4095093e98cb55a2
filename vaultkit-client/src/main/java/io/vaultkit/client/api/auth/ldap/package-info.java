/**
 * LDAP auth method.
 */
package io.vaultkit.client.api.auth.ldap;
