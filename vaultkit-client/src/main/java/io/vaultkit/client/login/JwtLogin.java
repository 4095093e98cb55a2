package io.vaultkit.client.login;

import io.vaultkit.client.AuthInfo;
import io.vaultkit.client.Preconditions;
import io.vaultkit.client.VaultClient;
import io.vaultkit.client.VaultException;
import io.vaultkit.client.api.auth.oidc.JwtLoginRequest;

/**
 * Login with the JWT auth method using a token the caller already holds, e.g. a CI job token.
 */
public final class JwtLogin implements LoginMethod {

    private final String role;
    private final String jwt;

    /**
     * @param role the role to log in with, or null for the mount's default role
     * @param jwt  the signed JWT
     */
    public JwtLogin(String role, String jwt) {
        this.role = role;
        this.jwt = Preconditions.requireNonBlank(jwt, "JWT");
    }

    @Override
    public AuthMethodType getAuthMethod() {
        return AuthMethodType.JWT;
    }

    @Override
    public AuthInfo login(VaultClient client, String mount) throws VaultException {
        return client.auth(new JwtLoginRequest(mount, role, jwt));
    }

    @Override
    public String toString() {
        return "JwtLogin{role='" + role + "'}";
    }
}
