package io.vaultkit.client.api.auth.approle;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Logs in with a role id and secret id. The token is in the envelope's {@code auth} block.
 *
 * @param mount    the auth mount, usually {@code approle}
 * @param roleId   the role id
 * @param secretId the secret id, or null if the role does not bind one
 */
@VaultEndpoint(path = "auth/{self.mount}/login", method = "POST")
public record AppRoleLoginRequest(String mount, String roleId, String secretId)
        implements AppRoleLoginRequestEndpoint {

    @Override
    public String toString() {
        return "AppRoleLoginRequest[mount=" + mount + ", roleId=" + roleId + ", secretId=***]";
    }
}
