package io.vaultkit.client.api.transit;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "{self.mount}/keys/{self.name}/config", method = "POST", builder = true)
public record UpdateKeyConfigRequest(
        String mount,
        String name,
        Integer minDecryptionVersion,
        Integer minEncryptionVersion,
        Boolean deletionAllowed,
        Boolean exportable,
        Boolean allowPlaintextBackup,
        String autoRotatePeriod) implements UpdateKeyConfigRequestEndpoint {
}
