package io.vaultkit.client;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable connection settings for a {@link VaultClient}.
 *
 * <p>Settings left unset on the builder are resolved from the environment when
 * {@link Builder#build()} runs:
 * <ul>
 *   <li>{@code VAULT_ADDR}: server address, default {@value #DEFAULT_ADDRESS}</li>
 *   <li>{@code VAULT_TOKEN}: initial token, default empty</li>
 *   <li>{@code VAULT_SKIP_VERIFY}: any value other than {@code 0}, {@code f} or {@code false}
 *       disables TLS verification</li>
 *   <li>{@code VAULT_CACERT}: a PEM file of trusted CA certificates</li>
 *   <li>{@code VAULT_CAPATH}: a directory of PEM files; files without a certificate block are skipped</li>
 *   <li>{@code VAULT_CLIENT_CERT} and {@code VAULT_CLIENT_KEY}: client identity for mutual TLS</li>
 *   <li>{@code VAULT_NAMESPACE}: Vault Enterprise namespace</li>
 * </ul>
 */
public final class VaultClientSettings {

    private static final Logger logger = LoggerFactory.getLogger(VaultClientSettings.class);

    public static final String DEFAULT_ADDRESS = "http://127.0.0.1:8200";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    static final String ENV_ADDRESS = "VAULT_ADDR";
    static final String ENV_TOKEN = "VAULT_TOKEN";
    static final String ENV_SKIP_VERIFY = "VAULT_SKIP_VERIFY";
    static final String ENV_CACERT = "VAULT_CACERT";
    static final String ENV_CAPATH = "VAULT_CAPATH";
    static final String ENV_CLIENT_CERT = "VAULT_CLIENT_CERT";
    static final String ENV_CLIENT_KEY = "VAULT_CLIENT_KEY";
    static final String ENV_NAMESPACE = "VAULT_NAMESPACE";

    private static final String PEM_CERTIFICATE = "-----BEGIN CERTIFICATE-----";
    private static final Set<String> VALID_SCHEMES = Set.of("http", "https");
    private static final Set<String> VERIFY_VALUES = Set.of("0", "f", "false");

    private final String address;
    private final String token;
    private final List<String> caCerts;
    private final String clientCert;
    private final String clientKey;
    private final boolean verify;
    private final int version;
    private final Duration timeout;
    private final String namespace;

    private VaultClientSettings(String address, String token, List<String> caCerts, String clientCert,
                                String clientKey, boolean verify, int version, Duration timeout,
                                String namespace) {
        this.address = address;
        this.token = token;
        this.caCerts = List.copyOf(caCerts);
        this.clientCert = clientCert;
        this.clientKey = clientKey;
        this.verify = verify;
        this.version = version;
        this.timeout = timeout;
        this.namespace = namespace;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Server address without a trailing slash, e.g. {@code https://vault:8200}. */
    public String getAddress() {
        return address;
    }

    /** Initial token; empty when none was configured. */
    public String getToken() {
        return token;
    }

    /** PEM files whose certificates are added to the trust store. */
    public List<String> getCaCerts() {
        return caCerts;
    }

    public String getClientCert() {
        return clientCert;
    }

    public String getClientKey() {
        return clientKey;
    }

    public boolean hasIdentity() {
        return clientCert != null && clientKey != null;
    }

    public boolean isVerify() {
        return verify;
    }

    /** API version, used as the {@code /v{version}} path prefix. */
    public int getVersion() {
        return version;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /** Vault Enterprise namespace, or null for the root namespace. */
    public String getNamespace() {
        return namespace;
    }

    @Override
    public String toString() {
        return "VaultClientSettings{" +
                "address='" + address + '\'' +
                ", token=" + (token.isEmpty() ? "<none>" : "<redacted>") +
                ", caCerts=" + caCerts +
                ", identity=" + hasIdentity() +
                ", verify=" + verify +
                ", version=" + version +
                ", timeout=" + timeout +
                ", namespace='" + namespace + '\'' +
                '}';
    }

    /**
     * Builder for {@link VaultClientSettings}. Explicit values always win over the
     * environment.
     */
    public static final class Builder {

        private String address;
        private String token;
        private List<String> caCerts;
        private String clientCert;
        private String clientKey;
        private Boolean verify;
        private int version = 1;
        private Duration timeout = DEFAULT_TIMEOUT;
        private String namespace;
        private Function<String, String> environment = System::getenv;

        private Builder() {
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        /**
         * Sets the trusted CA PEM files, replacing any from the environment.
         */
        public Builder caCerts(List<String> caCerts) {
            this.caCerts = new ArrayList<>(caCerts);
            return this;
        }

        /**
         * Sets the client identity for mutual TLS.
         *
         * @param certPath PEM certificate chain
         * @param keyPath  PEM private key in PKCS#8 form
         */
        public Builder identity(String certPath, String keyPath) {
            this.clientCert = Preconditions.requireNonBlank(certPath, "Client certificate path");
            this.clientKey = Preconditions.requireNonBlank(keyPath, "Client key path");
            return this;
        }

        public Builder verify(boolean verify) {
            this.verify = verify;
            return this;
        }

        public Builder version(int version) {
            if (version < 1) {
                throw new IllegalArgumentException("API version must be at least 1, got " + version);
            }
            this.version = version;
            return this;
        }

        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Timeout must be positive, got " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        /**
         * Replaces the environment lookup, {@code System::getenv} by default.
         */
        public Builder environment(Function<String, String> environment) {
            this.environment = Objects.requireNonNull(environment, "environment");
            return this;
        }

        /**
         * Resolves defaults and validates the address.
         *
         * @return the settings
         * @throws VaultException {@code CLIENT_BUILD} for an invalid address, {@code CERT_READ}
         *                        when {@code VAULT_CAPATH} cannot be listed
         */
        public VaultClientSettings build() throws VaultException {
            String resolvedAddress = address;
            if (resolvedAddress == null) {
                resolvedAddress = env(ENV_ADDRESS);
                if (resolvedAddress != null) {
                    logger.debug("Using Vault address from {}", ENV_ADDRESS);
                } else {
                    resolvedAddress = DEFAULT_ADDRESS;
                }
            }
            resolvedAddress = validateAddress(resolvedAddress);

            String resolvedToken = token != null ? token : env(ENV_TOKEN);
            if (token == null && resolvedToken != null) {
                logger.debug("Using Vault token from {}", ENV_TOKEN);
            }

            boolean resolvedVerify = verify != null ? verify : verifyFromEnvironment();

            List<String> resolvedCaCerts = caCerts != null ? caCerts : caCertsFromEnvironment();

            String resolvedCert = clientCert;
            String resolvedKey = clientKey;
            if (resolvedCert == null && env(ENV_CLIENT_CERT) != null && env(ENV_CLIENT_KEY) != null) {
                resolvedCert = env(ENV_CLIENT_CERT);
                resolvedKey = env(ENV_CLIENT_KEY);
                logger.debug("Using client identity from {} and {}", ENV_CLIENT_CERT, ENV_CLIENT_KEY);
            }

            String resolvedNamespace = namespace != null ? namespace : env(ENV_NAMESPACE);

            VaultClientSettings settings = new VaultClientSettings(resolvedAddress,
                    resolvedToken != null ? resolvedToken : "", resolvedCaCerts, resolvedCert, resolvedKey,
                    resolvedVerify, version, timeout, resolvedNamespace);
            logger.info("Vault client settings: {}", settings);
            return settings;
        }

        private String env(String name) {
            String value = environment.apply(name);
            return value == null || value.isBlank() ? null : value;
        }

        private boolean verifyFromEnvironment() {
            String skip = env(ENV_SKIP_VERIFY);
            if (skip == null) {
                return true;
            }
            boolean verifyValue = VERIFY_VALUES.contains(skip.trim().toLowerCase(Locale.ROOT));
            if (!verifyValue) {
                logger.debug("TLS verification disabled by {}", ENV_SKIP_VERIFY);
            }
            return verifyValue;
        }

        private List<String> caCertsFromEnvironment() throws VaultException {
            List<String> paths = new ArrayList<>();
            String caCert = env(ENV_CACERT);
            if (caCert != null) {
                paths.add(caCert);
            }
            String caPath = env(ENV_CAPATH);
            if (caPath != null) {
                List<Path> files;
                try (Stream<Path> entries = Files.list(Path.of(caPath))) {
                    files = entries.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
                } catch (IOException e) {
                    throw VaultException.certRead(caPath, e);
                }
                for (Path file : files) {
                    if (containsCertificate(file)) {
                        paths.add(file.toString());
                    } else {
                        logger.debug("Skipping {} in {}: no PEM certificate", file.getFileName(), ENV_CAPATH);
                    }
                }
            }
            return paths;
        }

        private static boolean containsCertificate(Path file) throws VaultException {
            try {
                return new String(Files.readAllBytes(file), StandardCharsets.ISO_8859_1).contains(PEM_CERTIFICATE);
            } catch (IOException e) {
                throw VaultException.certRead(file.toString(), e);
            }
        }

        private static String validateAddress(String value) throws VaultException {
            URI uri;
            try {
                uri = URI.create(value.trim());
            } catch (IllegalArgumentException e) {
                throw new VaultException(ErrorKind.CLIENT_BUILD, "Invalid Vault address: " + value, e);
            }
            String scheme = uri.getScheme();
            if (scheme == null || !VALID_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
                throw new VaultException(ErrorKind.CLIENT_BUILD,
                        "Invalid Vault address: " + value + " (scheme must be http or https)");
            }
            if (uri.getHost() == null) {
                throw new VaultException(ErrorKind.CLIENT_BUILD,
                        "Invalid Vault address: " + value + " (missing host)");
            }
            String normalized = uri.toString();
            // Remove trailing slash for consistent URL building
            return normalized.endsWith("/") ? normalized.substring(0, normalized.length() - 1) : normalized;
        }
    }
}
