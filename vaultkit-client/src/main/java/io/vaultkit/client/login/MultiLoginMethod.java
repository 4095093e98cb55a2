package io.vaultkit.client.login;

import io.vaultkit.client.VaultClient;
import io.vaultkit.client.VaultException;

/**
 * The first phase of a login that needs an interaction before a token can be issued.
 *
 * @param <C> the callback that completes the login
 * @see VaultClient#loginMulti(String, MultiLoginMethod)
 */
public interface MultiLoginMethod<C extends MultiLoginCallback> {

    AuthMethodType getAuthMethod();

    /**
     * Starts the login.
     *
     * @param client the client to send requests with
     * @param mount  the mount path of the auth method
     * @return the callback to finish the login with
     * @throws VaultException if the first phase fails
     */
    C login(VaultClient client, String mount) throws VaultException;
}
