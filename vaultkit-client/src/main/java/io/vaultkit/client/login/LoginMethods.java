package io.vaultkit.client.login;

import io.vaultkit.client.ErrorKind;
import io.vaultkit.client.Preconditions;
import io.vaultkit.client.VaultClient;
import io.vaultkit.client.VaultException;
import io.vaultkit.client.api.sys.AuthResponse;
import io.vaultkit.client.api.sys.AuthsResponse;
import io.vaultkit.client.api.sys.ListAuthsRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers the auth methods enabled on a server. Needs a token allowed to read
 * {@code sys/auth}.
 */
public final class LoginMethods {

    private static final Logger logger = LoggerFactory.getLogger(LoginMethods.class);

    private LoginMethods() {
        // Utility class
    }

    /**
     * Lists the enabled auth methods.
     *
     * <p>Types this library does not know are logged at warn and left out.
     *
     * @param client the client to query with
     * @return mount path (with trailing slash, e.g. {@code approle/}) to method type, in
     *         server order
     * @throws VaultException if the listing fails
     */
    public static Map<String, AuthMethodType> list(VaultClient client) throws VaultException {
        AuthsResponse mounts = client.execute(new ListAuthsRequest());
        Map<String, AuthMethodType> methods = new LinkedHashMap<>();
        for (Map.Entry<String, AuthResponse> entry : mounts.entrySet()) {
            String type = entry.getValue().type();
            Optional<AuthMethodType> known = AuthMethodType.find(type);
            if (known.isPresent()) {
                methods.put(entry.getKey(), known.get());
            } else {
                logger.warn("Skipping auth mount '{}' with unknown type '{}'", entry.getKey(), type);
            }
        }
        return methods;
    }

    /**
     * Lists the enabled auth methods this library can log in with.
     *
     * @param client the client to query with
     * @return mount path to method type
     * @throws VaultException if the listing fails
     */
    public static Map<String, AuthMethodType> listSupported(VaultClient client) throws VaultException {
        Map<String, AuthMethodType> methods = list(client);
        methods.values().removeIf(type -> !type.isSupported());
        return methods;
    }

    /**
     * Checks that {@code mount} is an auth mount of the expected type.
     *
     * @param client   the client to query with
     * @param mount    the mount path, with or without trailing slash
     * @param expected the expected type
     * @throws VaultException {@code INVALID_LOGIN_METHOD} if nothing is mounted there or the
     *                        mount has another type
     */
    public static void require(VaultClient client, String mount, AuthMethodType expected) throws VaultException {
        Preconditions.requireNonBlank(mount, "Mount");
        String key = mount.endsWith("/") ? mount : mount + "/";
        AuthMethodType actual = list(client).get(key);
        if (actual == null) {
            throw new VaultException(ErrorKind.INVALID_LOGIN_METHOD, "No auth method is mounted at '" + mount + "'");
        }
        if (actual != expected) {
            throw new VaultException(ErrorKind.INVALID_LOGIN_METHOD,
                    "Auth mount '" + mount + "' is of type " + actual + ", expected " + expected);
        }
    }
}
