package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.Map;

/**
 * Enables a secrets engine at {@code path}.
 *
 * @param path        the mount path
 * @param type        the engine type, e.g. {@code kv} or {@code transit}
 * @param description human-readable description
 * @param config      mount tuning such as {@code default_lease_ttl}
 * @param options     engine options, e.g. {@code {"version": "2"}} for KV v2
 */
@VaultEndpoint(path = "sys/mounts/{self.path}", builder = true)
public record EnableEngineRequest(
        String path,
        String type,
        String description,
        Map<String, Object> config,
        Map<String, String> options) implements EnableEngineRequestEndpoint {
}
