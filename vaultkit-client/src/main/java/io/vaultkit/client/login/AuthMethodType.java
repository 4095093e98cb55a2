package io.vaultkit.client.login;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Vault auth method types, as reported in the {@code type} field of {@code sys/auth}.
 */
public enum AuthMethodType {

    APPROLE("approle", true),
    AWS("aws", false),
    AZURE("azure", false),
    CERT("cert", true),
    CF("cf", false),
    GCP("gcp", false),
    GITHUB("github", false),
    JWT("jwt", true),
    KERBEROS("kerberos", false),
    KUBERNETES("kubernetes", true),
    LDAP("ldap", true),
    OCI("oci", false),
    OIDC("oidc", true),
    OKTA("okta", false),
    RADIUS("radius", false),
    TOKEN("token", false),
    USERPASS("userpass", true);

    private final String value;
    private final boolean supported;

    AuthMethodType(String value, boolean supported) {
        this.value = value;
        this.supported = supported;
    }

    /**
     * Returns the type string Vault uses, which is also the conventional mount path.
     *
     * @return the type string (e.g., "approle", "userpass")
     */
    public String getValue() {
        return value;
    }

    /**
     * Indicates whether this library ships a login strategy for the type.
     *
     * @return true if the type can be logged in with
     */
    public boolean isSupported() {
        return supported;
    }

    /**
     * Looks up a type string.
     *
     * @param value the type string (case-insensitive)
     * @return the type, or empty if it is not known
     */
    public static Optional<AuthMethodType> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    /**
     * Parses a type string.
     *
     * @param value the type string (case-insensitive)
     * @return the corresponding type
     * @throws IllegalArgumentException if the value is blank or not recognized
     */
    public static AuthMethodType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Auth method cannot be null or blank");
        }
        return find(value).orElseThrow(() -> new IllegalArgumentException(
                "Invalid auth method: '" + value + "'. Supported values: " + Arrays.stream(values())
                        .map(AuthMethodType::getValue)
                        .collect(Collectors.joining(", "))));
    }

    @Override
    public String toString() {
        return value;
    }
}
