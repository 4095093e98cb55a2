package io.vaultkit.client.login;

import io.vaultkit.client.AuthInfo;
import io.vaultkit.client.VaultClient;
import io.vaultkit.client.VaultException;

/**
 * A single-request login.
 *
 * <p>Implementations only exchange credentials for an {@link AuthInfo}; adopting the token is
 * done by {@link VaultClient#login(String, LoginMethod)}. A method may be used for several
 * logins, and implementations that read credentials from a file or the environment read them
 * again on every call.
 *
 * @see MultiLoginMethod
 */
public interface LoginMethod {

    /**
     * Returns the auth method type, used for logging and as the default mount.
     *
     * @return the auth method type
     */
    AuthMethodType getAuthMethod();

    /**
     * Sends the login request.
     *
     * @param client the client to send the request with
     * @param mount  the mount path of the auth method
     * @return the auth block of the login response
     * @throws VaultException if Vault rejects the credentials or cannot be reached
     */
    AuthInfo login(VaultClient client, String mount) throws VaultException;
}
