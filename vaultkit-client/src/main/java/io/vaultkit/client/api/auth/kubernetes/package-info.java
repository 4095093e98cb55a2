/**
 * Kubernetes auth method: login with a pod's service account token.
 */
package io.vaultkit.client.api.auth.kubernetes;
