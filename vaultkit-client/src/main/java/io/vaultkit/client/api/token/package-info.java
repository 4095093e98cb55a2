/**
 * Token auth method endpoints ({@code auth/token/...}).
 */
package io.vaultkit.client.api.token;
