/**
 * System backend endpoints: mounts, auth methods, ACL policies, response wrapping,
 * health and seal status.
 */
package io.vaultkit.client.api.sys;
