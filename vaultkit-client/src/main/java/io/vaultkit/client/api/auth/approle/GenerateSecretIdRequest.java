package io.vaultkit.client.api.auth.approle;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;

/**
 * Issues a new secret id for a role.
 *
 * @param mount    the auth mount
 * @param roleName the role
 * @param metadata JSON-encoded key/value metadata attached to tokens issued with this secret id
 * @param cidrList CIDR blocks allowed to use the secret id
 * @param ttl      lifetime of the secret id, or null for the role default
 */
@VaultEndpoint(path = "auth/{self.mount}/role/{self.roleName}/secret-id", method = "POST",
        response = GenerateSecretIdResponse.class)
public record GenerateSecretIdRequest(
        String mount,
        String roleName,
        String metadata,
        List<String> cidrList,
        String ttl) implements GenerateSecretIdRequestEndpoint {

    public GenerateSecretIdRequest(String mount, String roleName) {
        this(mount, roleName, null, null, null);
    }
}
