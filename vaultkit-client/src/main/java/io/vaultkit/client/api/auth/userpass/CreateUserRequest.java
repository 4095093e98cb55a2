package io.vaultkit.client.api.auth.userpass;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;

/**
 * Creates or updates a user.
 */
@VaultEndpoint(path = "auth/{self.mount}/users/{self.username}", method = "POST", builder = true)
public record CreateUserRequest(
        String mount,
        String username,
        String password,
        List<String> tokenPolicies,
        String tokenTtl,
        String tokenMaxTtl) implements CreateUserRequestEndpoint {

    @Override
    public String toString() {
        return "CreateUserRequest[mount=" + mount + ", username=" + username + ", tokenPolicies="
                + tokenPolicies + "]";
    }
}
