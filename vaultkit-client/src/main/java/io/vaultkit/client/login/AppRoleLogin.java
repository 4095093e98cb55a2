package io.vaultkit.client.login;

import io.vaultkit.client.AuthInfo;
import io.vaultkit.client.Preconditions;
import io.vaultkit.client.VaultClient;
import io.vaultkit.client.VaultException;
import io.vaultkit.client.api.auth.approle.AppRoleLoginRequest;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Login with the AppRole auth method.
 *
 * <p>The secret id can come from one of three sources:
 * <ul>
 *   <li>a static value, see {@link #of(String, String)}</li>
 *   <li>a file, re-read on each login, see {@link #fromFile(String, Path)}</li>
 *   <li>an environment variable, re-read on each login, see {@link #fromEnvironment(String, String)}</li>
 * </ul>
 *
 * <p>File and environment sources let a Vault Agent, init container or sidecar rotate the
 * secret id between logins.
 */
public final class AppRoleLogin implements LoginMethod {

    private static final Logger logger = LoggerFactory.getLogger(AppRoleLogin.class);

    private final String roleId;
    private final String staticSecretId;
    private final Path secretFile;
    private final String secretEnvVarName;
    private final Function<String, String> environment;
    private final String secretSource;

    private AppRoleLogin(String roleId, String staticSecretId, Path secretFile, String secretEnvVarName,
                         Function<String, String> environment, String secretSource) {
        this.roleId = roleId;
        this.staticSecretId = staticSecretId;
        this.secretFile = secretFile;
        this.secretEnvVarName = secretEnvVarName;
        this.environment = environment;
        this.secretSource = secretSource;
    }

    /**
     * Creates a login with a static secret id.
     *
     * @param roleId   the role id
     * @param secretId the secret id
     * @return the login method
     * @throws IllegalArgumentException if either value is null or blank
     */
    public static AppRoleLogin of(String roleId, String secretId) {
        Preconditions.requireNonBlank(roleId, "Role ID");
        Preconditions.requireNonBlank(secretId, "Secret ID");
        return new AppRoleLogin(roleId, secretId, null, null, null, "static secret ID");
    }

    /**
     * Creates a login that reads the secret id from a file on every login.
     *
     * @param roleId     the role id
     * @param secretFile file holding the secret id; surrounding whitespace is ignored
     * @return the login method
     */
    public static AppRoleLogin fromFile(String roleId, Path secretFile) {
        Preconditions.requireNonBlank(roleId, "Role ID");
        Objects.requireNonNull(secretFile, "secretFile");
        return new AppRoleLogin(roleId, null, secretFile, null, null, "secret file: " + secretFile);
    }

    /**
     * Creates a login that reads the secret id from an environment variable on every login.
     *
     * @param roleId     the role id
     * @param envVarName the variable holding the secret id
     * @return the login method
     */
    public static AppRoleLogin fromEnvironment(String roleId, String envVarName) {
        return fromEnvironment(roleId, envVarName, System::getenv);
    }

    static AppRoleLogin fromEnvironment(String roleId, String envVarName, Function<String, String> environment) {
        Preconditions.requireNonBlank(roleId, "Role ID");
        Preconditions.requireNonBlank(envVarName, "Environment variable name");
        return new AppRoleLogin(roleId, null, null, envVarName, environment,
                envVarName + " environment variable");
    }

    /**
     * Creates a login from whichever secret source is available, preferring a readable file
     * over the environment variable.
     *
     * @param roleId         the role id
     * @param envVarName     environment variable for the secret id
     * @param secretFilePath path to the secret file, or null
     * @return the login method
     * @throws SecurityException if neither source holds a secret id
     */
    public static AppRoleLogin create(String roleId, String envVarName, String secretFilePath) {
        return create(roleId, envVarName, secretFilePath, System::getenv);
    }

    static AppRoleLogin create(String roleId, String envVarName, String secretFilePath,
                               Function<String, String> environment) {
        if (roleId == null || roleId.isBlank()) {
            throw new SecurityException("AppRole role ID is required");
        }

        if (secretFilePath != null && !secretFilePath.isBlank()) {
            Path file = Path.of(secretFilePath);
            if (Files.isReadable(file)) {
                return fromFile(roleId, file);
            }
            logger.debug("Secret file not readable: {}, checking environment variable", secretFilePath);
        }

        String envSecret = environment.apply(envVarName);
        if (envSecret != null && !envSecret.isBlank()) {
            if (secretFilePath != null && !secretFilePath.isBlank()) {
                logger.info("Using secret ID from {} (secret file {} not available)", envVarName, secretFilePath);
            }
            return fromEnvironment(roleId, envVarName, environment);
        }

        throw new SecurityException("AppRole login requires a secret ID. Set " + envVarName
                + " or provide a readable secret file path.");
    }

    @Override
    public AuthMethodType getAuthMethod() {
        return AuthMethodType.APPROLE;
    }

    /**
     * {@inheritDoc}
     *
     * @throws SecurityException if the secret file or variable is missing or empty
     */
    @Override
    public AuthInfo login(VaultClient client, String mount) throws VaultException {
        String secretId = resolveSecretId();
        logger.debug("AppRole login at mount '{}' using {}", mount, secretSource);
        return client.auth(new AppRoleLoginRequest(mount, roleId, secretId));
    }

    private String resolveSecretId() {
        if (staticSecretId != null) {
            return staticSecretId;
        }
        if (secretFile != null) {
            return readSecretFile();
        }
        return readSecretEnvVar();
    }

    private String readSecretFile() {
        try {
            String content = Files.readString(secretFile).trim();
            if (content.isEmpty()) {
                throw new SecurityException("Secret file is empty: " + secretFile);
            }
            return content;
        } catch (IOException e) {
            throw new SecurityException("Cannot read secret file: " + secretFile, e);
        }
    }

    private String readSecretEnvVar() {
        String value = environment.apply(secretEnvVarName);
        if (value == null || value.isBlank()) {
            throw new SecurityException("Environment variable " + secretEnvVarName + " is not set or is empty");
        }
        return value;
    }

    public String getRoleId() {
        return roleId;
    }

    /**
     * Returns a description of the secret source (for logging).
     *
     * @return the secret source description
     */
    public String getSecretSource() {
        return secretSource;
    }

    @Override
    public String toString() {
        return "AppRoleLogin{roleId='" + roleId + "', secretSource='" + secretSource + "'}";
    }
}
