package io.vaultkit.client.api.kv1;

import java.util.LinkedHashMap;

/**
 * The stored secret, exactly as written.
 */
public class GetSecretResponse extends LinkedHashMap<String, Object> {

    private static final long serialVersionUID = 1L;
}
