package io.vaultkit.client.api.sys;

import java.util.LinkedHashMap;

/**
 * Mount path (with trailing slash) to mount description.
 */
public class MountsResponse extends LinkedHashMap<String, MountResponse> {

    private static final long serialVersionUID = 1L;
}
