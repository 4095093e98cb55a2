package io.vaultkit.client.api.sys;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.Map;

/**
 * Wraps arbitrary data in a single-use token. Must be sent in wrap mode, see
 * {@code VaultClient#wrap}.
 */
@VaultEndpoint(path = "sys/wrapping/wrap", method = "POST")
public record WrappingWrapRequest(@VaultEndpoint.Body Map<String, Object> data)
        implements WrappingWrapRequestEndpoint {
}
