package io.vaultkit.client.api.sys;

import java.util.LinkedHashMap;

/**
 * Auth mount path (with trailing slash) to auth method description.
 */
public class AuthsResponse extends LinkedHashMap<String, AuthResponse> {

    private static final long serialVersionUID = 1L;
}
