package io.vaultkit.client.login;

import io.vaultkit.client.AuthInfo;
import io.vaultkit.client.Preconditions;
import io.vaultkit.client.VaultClient;
import io.vaultkit.client.VaultException;
import io.vaultkit.client.api.auth.userpass.UserpassLoginRequest;

/**
 * Login with the userpass auth method.
 */
public final class UserpassLogin implements LoginMethod {

    private final String username;
    private final String password;

    public UserpassLogin(String username, String password) {
        this.username = Preconditions.requireNonBlank(username, "Username");
        this.password = Preconditions.requireNonBlank(password, "Password");
    }

    @Override
    public AuthMethodType getAuthMethod() {
        return AuthMethodType.USERPASS;
    }

    @Override
    public AuthInfo login(VaultClient client, String mount) throws VaultException {
        return client.auth(new UserpassLoginRequest(mount, username, password));
    }

    @Override
    public String toString() {
        return "UserpassLogin{username='" + username + "'}";
    }
}
