/**
 * Identity entities: the Vault-side representation of a person or service across
 * auth methods.
 */
package io.vaultkit.client.api.identity.entity;
