package io.vaultkit.client.api.kv2;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.Map;

@VaultEndpoint(path = "{self.mount}/metadata/{self.path}", method = "POST", builder = true)
public record SetSecretMetadataRequest(
        String mount,
        String path,
        Integer maxVersions,
        Boolean casRequired,
        String deleteVersionAfter,
        Map<String, String> customMetadata) implements SetSecretMetadataRequestEndpoint {
}
