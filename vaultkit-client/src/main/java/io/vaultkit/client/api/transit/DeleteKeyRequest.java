package io.vaultkit.client.api.transit;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Deletes a key. Fails unless {@code deletion_allowed} was set through
 * {@link UpdateKeyConfigRequest}.
 */
@VaultEndpoint(path = "{self.mount}/keys/{self.name}", method = "DELETE")
public record DeleteKeyRequest(String mount, String name) implements DeleteKeyRequestEndpoint {
}
