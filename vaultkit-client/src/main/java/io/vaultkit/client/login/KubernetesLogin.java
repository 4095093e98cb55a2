package io.vaultkit.client.login;

import io.vaultkit.client.AuthInfo;
import io.vaultkit.client.Preconditions;
import io.vaultkit.client.VaultClient;
import io.vaultkit.client.VaultException;
import io.vaultkit.client.api.auth.kubernetes.KubernetesLoginRequest;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Login with the Kubernetes auth method using a service account JWT.
 *
 * <p>When created with {@link #fromServiceAccount(String)} the token file is re-read on each
 * login, so projected tokens that the kubelet rotates keep working.
 */
public final class KubernetesLogin implements LoginMethod {

    /** Where Kubernetes mounts the pod's service account token. */
    public static final Path DEFAULT_TOKEN_PATH = Path.of("/var/run/secrets/kubernetes.io/serviceaccount/token");

    private final String role;
    private final String jwt;
    private final Path tokenFile;

    private KubernetesLogin(String role, String jwt, Path tokenFile) {
        this.role = Preconditions.requireNonBlank(role, "Role");
        this.jwt = jwt;
        this.tokenFile = tokenFile;
    }

    /**
     * Creates a login with a JWT the caller already holds.
     */
    public static KubernetesLogin of(String role, String jwt) {
        return new KubernetesLogin(role, Preconditions.requireNonBlank(jwt, "JWT"), null);
    }

    /**
     * Creates a login that reads the JWT from {@link #DEFAULT_TOKEN_PATH}.
     */
    public static KubernetesLogin fromServiceAccount(String role) {
        return fromFile(role, DEFAULT_TOKEN_PATH);
    }

    /**
     * Creates a login that reads the JWT from a file on each login.
     */
    public static KubernetesLogin fromFile(String role, Path tokenFile) {
        return new KubernetesLogin(role, null, Objects.requireNonNull(tokenFile, "tokenFile"));
    }

    @Override
    public AuthMethodType getAuthMethod() {
        return AuthMethodType.KUBERNETES;
    }

    /**
     * {@inheritDoc}
     *
     * @throws SecurityException if the token file cannot be read or is empty
     */
    @Override
    public AuthInfo login(VaultClient client, String mount) throws VaultException {
        return client.auth(new KubernetesLoginRequest(mount, role, resolveJwt()));
    }

    private String resolveJwt() {
        if (jwt != null) {
            return jwt;
        }
        try {
            String content = Files.readString(tokenFile).trim();
            if (content.isEmpty()) {
                throw new SecurityException("Service account token file is empty: " + tokenFile);
            }
            return content;
        } catch (IOException e) {
            throw new SecurityException("Cannot read service account token file: " + tokenFile, e);
        }
    }

    @Override
    public String toString() {
        return "KubernetesLogin{role='" + role + "', source="
                + (tokenFile != null ? tokenFile.toString() : "static JWT") + "}";
    }
}
