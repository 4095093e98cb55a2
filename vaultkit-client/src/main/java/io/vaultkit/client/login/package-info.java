/**
 * Login strategies for {@link io.vaultkit.client.VaultClient}.
 *
 * <p>A {@link io.vaultkit.client.login.LoginMethod} obtains a token in one request. A
 * {@link io.vaultkit.client.login.MultiLoginMethod} needs an interaction in between, such as
 * the OIDC browser redirect: its first phase returns a
 * {@link io.vaultkit.client.login.MultiLoginCallback} that finishes the login.
 * {@link io.vaultkit.client.login.LoginMethods} discovers which methods a server offers.
 */
package io.vaultkit.client.login;
