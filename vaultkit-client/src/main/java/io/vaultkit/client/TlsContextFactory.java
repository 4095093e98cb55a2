package io.vaultkit.client;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the TLS part of {@link VaultClientSettings} into an {@link SSLContext}.
 *
 * <p>CA files are trusted in addition to the JDK's default roots. Client identities must be
 * PEM with the key in PKCS#8 form, RSA or EC. Failures name the file: {@code CERT_READ} when
 * it cannot be read, {@code CERT_PARSE} when its content is unusable.
 */
final class TlsContextFactory {

    private static final Logger logger = LoggerFactory.getLogger(TlsContextFactory.class);

    private static final Pattern PEM_BLOCK = Pattern.compile(
            "-----BEGIN ([A-Z0-9 ]+)-----([A-Za-z0-9+/=\\s]*?)-----END \\1-----");

    private static final String CERTIFICATE = "CERTIFICATE";
    private static final String PKCS8_KEY = "PRIVATE KEY";
    private static final char[] NO_PASSWORD = new char[0];

    private TlsContextFactory() {
    }

    /**
     * Whether {@code settings} need anything beyond the JDK's default TLS setup.
     */
    static boolean isCustomized(VaultClientSettings settings) {
        return !settings.isVerify() || !settings.getCaCerts().isEmpty() || settings.hasIdentity();
    }

    /**
     * @throws VaultException {@code CERT_READ}, {@code CERT_PARSE}, or {@code CLIENT_BUILD} when
     *                        the JDK rejects the resulting key material
     */
    static SSLContext create(VaultClientSettings settings) throws VaultException {
        TrustManager[] trust = settings.isVerify() ? trustManagers(settings.getCaCerts()) : insecure();
        KeyManager[] keys = settings.hasIdentity()
                ? keyManagers(settings.getClientCert(), settings.getClientKey())
                : null;
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(keys, trust, null);
            return context;
        } catch (GeneralSecurityException e) {
            throw new VaultException(ErrorKind.CLIENT_BUILD, "Cannot initialise TLS: " + e.getMessage(), e);
        }
    }

    private static TrustManager[] insecure() {
        logger.warn("TLS certificate verification is disabled");
        return new TrustManager[]{new InsecureTrustManager()};
    }

    static TrustManager[] trustManagers(List<String> caFiles) throws VaultException {
        if (caFiles.isEmpty()) {
            return null;
        }
        KeyStore anchors = emptyKeyStore();
        int count = 0;
        for (String file : caFiles) {
            for (X509Certificate certificate : loadCertificates(file)) {
                try {
                    anchors.setCertificateEntry("ca-" + count++, certificate);
                } catch (GeneralSecurityException e) {
                    throw VaultException.certParse(file, e.getMessage(), e);
                }
            }
        }
        logger.debug("Trusting {} CA certificate(s) from {} in addition to the JDK roots", count, caFiles);
        return new TrustManager[]{new CombinedTrustManager(List.of(x509TrustManager(anchors), x509TrustManager(null)))};
    }

    private static X509ExtendedTrustManager x509TrustManager(KeyStore anchors) throws VaultException {
        try {
            TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            factory.init(anchors);
            for (TrustManager manager : factory.getTrustManagers()) {
                if (manager instanceof X509ExtendedTrustManager) {
                    return (X509ExtendedTrustManager) manager;
                }
            }
        } catch (GeneralSecurityException e) {
            throw new VaultException(ErrorKind.CLIENT_BUILD, "Cannot build trust store: " + e.getMessage(), e);
        }
        throw new VaultException(ErrorKind.CLIENT_BUILD, "No X.509 trust manager available");
    }

    private static KeyManager[] keyManagers(String certFile, String keyFile) throws VaultException {
        List<X509Certificate> chain = loadCertificates(certFile);
        PrivateKey key = loadPrivateKey(keyFile);
        KeyStore identity = emptyKeyStore();
        try {
            identity.setKeyEntry("client", key, NO_PASSWORD, chain.toArray(new X509Certificate[0]));
            KeyManagerFactory factory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            factory.init(identity, NO_PASSWORD);
            logger.debug("Using client certificate {} for mutual TLS", certFile);
            return factory.getKeyManagers();
        } catch (GeneralSecurityException e) {
            throw new VaultException(ErrorKind.CLIENT_BUILD,
                    "Cannot use client certificate " + certFile + ": " + e.getMessage(), e);
        }
    }

    private static KeyStore emptyKeyStore() throws VaultException {
        try {
            KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
            store.load(null, null);
            return store;
        } catch (IOException | GeneralSecurityException e) {
            throw new VaultException(ErrorKind.CLIENT_BUILD, "Cannot create key store: " + e.getMessage(), e);
        }
    }

    static List<X509Certificate> loadCertificates(String file) throws VaultException {
        List<X509Certificate> certificates = new ArrayList<>();
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            for (PemBlock block : readPem(file)) {
                if (CERTIFICATE.equals(block.type())) {
                    certificates.add((X509Certificate) factory.generateCertificate(
                            new ByteArrayInputStream(block.der())));
                }
            }
        } catch (CertificateException e) {
            throw VaultException.certParse(file, e.getMessage(), e);
        }
        if (certificates.isEmpty()) {
            throw VaultException.certParse(file, "no certificates found", null);
        }
        return certificates;
    }

    static PrivateKey loadPrivateKey(String file) throws VaultException {
        for (PemBlock block : readPem(file)) {
            if (PKCS8_KEY.equals(block.type())) {
                return decodePkcs8(file, block.der());
            }
            if (block.type().endsWith(" PRIVATE KEY")) {
                throw VaultException.certParse(file, block.type() + " blocks are not supported; convert the key with "
                        + "'openssl pkcs8 -topk8 -nocrypt -in " + file + "'", null);
            }
        }
        throw VaultException.certParse(file, "no private key found", null);
    }

    private static PrivateKey decodePkcs8(String file, byte[] der) throws VaultException {
        PKCS8EncodedKeySpec spec = new PKCS8EncodedKeySpec(der);
        for (String algorithm : new String[]{"RSA", "EC"}) {
            try {
                return KeyFactory.getInstance(algorithm).generatePrivate(spec);
            } catch (GeneralSecurityException e) {
                logger.trace("Key in {} is not {}: {}", file, algorithm, e.getMessage());
            }
        }
        throw VaultException.certParse(file, "unsupported private key algorithm, expected RSA or EC", null);
    }

    private static List<PemBlock> readPem(String file) throws VaultException {
        String text;
        try {
            text = Files.readString(Path.of(file), StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw VaultException.certRead(file, e);
        }
        List<PemBlock> blocks = new ArrayList<>();
        Matcher matcher = PEM_BLOCK.matcher(text);
        while (matcher.find()) {
            try {
                blocks.add(new PemBlock(matcher.group(1), Base64.getMimeDecoder().decode(matcher.group(2))));
            } catch (IllegalArgumentException e) {
                throw VaultException.certParse(file, "bad base64 in " + matcher.group(1) + " block", e);
            }
        }
        return blocks;
    }

    private record PemBlock(String type, byte[] der) {
    }

    /**
     * Trusts a chain when any delegate does, trying them in order. The delegates are JSSE's own
     * managers, so hostname checks on the socket and engine variants still apply.
     */
    private static final class CombinedTrustManager extends X509ExtendedTrustManager {

        private final List<X509ExtendedTrustManager> delegates;

        CombinedTrustManager(List<X509ExtendedTrustManager> delegates) {
            this.delegates = delegates;
        }

        @FunctionalInterface
        private interface TrustCheck {
            void check(X509ExtendedTrustManager delegate) throws CertificateException;
        }

        private void anyOf(TrustCheck check) throws CertificateException {
            CertificateException failure = null;
            for (X509ExtendedTrustManager delegate : delegates) {
                try {
                    check.check(delegate);
                    return;
                } catch (CertificateException e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            throw failure != null ? failure : new CertificateException("No trust managers configured");
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
            anyOf(delegate -> delegate.checkClientTrusted(chain, authType));
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
            anyOf(delegate -> delegate.checkServerTrusted(chain, authType));
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket)
                throws CertificateException {
            anyOf(delegate -> delegate.checkClientTrusted(chain, authType, socket));
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket)
                throws CertificateException {
            anyOf(delegate -> delegate.checkServerTrusted(chain, authType, socket));
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
                throws CertificateException {
            anyOf(delegate -> delegate.checkClientTrusted(chain, authType, engine));
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
                throws CertificateException {
            anyOf(delegate -> delegate.checkServerTrusted(chain, authType, engine));
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            List<X509Certificate> issuers = new ArrayList<>();
            for (X509ExtendedTrustManager delegate : delegates) {
                issuers.addAll(Arrays.asList(delegate.getAcceptedIssuers()));
            }
            return issuers.toArray(new X509Certificate[0]);
        }
    }

    /**
     * Accepts any server. Being an {@link X509ExtendedTrustManager} also turns off the hostname
     * check JSSE would otherwise add.
     */
    private static final class InsecureTrustManager extends X509ExtendedTrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
