package io.vaultkit.client.login;

import io.vaultkit.client.AuthInfo;
import io.vaultkit.client.Preconditions;
import io.vaultkit.client.VaultClient;
import io.vaultkit.client.VaultException;
import io.vaultkit.client.api.auth.ldap.LdapLoginRequest;

/**
 * Login with the LDAP auth method.
 */
public final class LdapLogin implements LoginMethod {

    private final String username;
    private final String password;

    public LdapLogin(String username, String password) {
        this.username = Preconditions.requireNonBlank(username, "Username");
        this.password = Preconditions.requireNonBlank(password, "Password");
    }

    @Override
    public AuthMethodType getAuthMethod() {
        return AuthMethodType.LDAP;
    }

    @Override
    public AuthInfo login(VaultClient client, String mount) throws VaultException {
        return client.auth(new LdapLoginRequest(mount, username, password));
    }

    @Override
    public String toString() {
        return "LdapLogin{username='" + username + "'}";
    }
}
