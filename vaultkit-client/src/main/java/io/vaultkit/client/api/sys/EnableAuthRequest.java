package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.Map;

/**
 * Enables an auth method at {@code path}, e.g. {@code approle} or {@code userpass}.
 */
@VaultEndpoint(path = "sys/auth/{self.path}", builder = true)
public record EnableAuthRequest(
        String path,
        String type,
        String description,
        Map<String, Object> config,
        Boolean local,
        Map<String, String> options) implements EnableAuthRequestEndpoint {
}
