package io.vaultkit.client.login;

import io.vaultkit.client.AuthInfo;
import io.vaultkit.client.VaultClient;
import io.vaultkit.client.VaultException;

/**
 * The second phase of a {@link MultiLoginMethod}. Completes at most once.
 *
 * @see VaultClient#loginMultiCallback(String, MultiLoginCallback)
 */
public interface MultiLoginCallback {

    /**
     * Waits for the interaction to finish and exchanges its result for a token.
     *
     * @param client the client to send the request with
     * @param mount  the mount path used for the first phase
     * @return the auth block of the login response
     * @throws VaultException if the login fails or was cancelled
     */
    AuthInfo callback(VaultClient client, String mount) throws VaultException;
}
