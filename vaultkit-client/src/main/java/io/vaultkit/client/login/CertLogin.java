package io.vaultkit.client.login;

import io.vaultkit.client.AuthInfo;
import io.vaultkit.client.VaultClient;
import io.vaultkit.client.VaultException;
import io.vaultkit.client.api.auth.cert.CertLoginRequest;

/**
 * Login with the TLS certificate auth method.
 *
 * <p>The credentials are the client certificate of the TLS connection, so the client must be
 * built with {@code VaultClientSettings.Builder#identity(String, String)}.
 */
public final class CertLogin implements LoginMethod {

    private final String name;

    /** Matches the certificate against every role of the mount. */
    public CertLogin() {
        this(null);
    }

    /**
     * @param name the certificate role to match, or null for any
     */
    public CertLogin(String name) {
        this.name = name;
    }

    @Override
    public AuthMethodType getAuthMethod() {
        return AuthMethodType.CERT;
    }

    @Override
    public AuthInfo login(VaultClient client, String mount) throws VaultException {
        return client.auth(new CertLoginRequest(mount, name));
    }

    @Override
    public String toString() {
        return "CertLogin{name='" + name + "'}";
    }
}
