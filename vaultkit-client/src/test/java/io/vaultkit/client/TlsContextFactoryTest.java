package io.vaultkit.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import org.junit.jupiter.api.Test;

class TlsContextFactoryTest {

    private static String fixture(String name) {
        try {
            return Path.of(TlsContextFactoryTest.class.getResource("/tls/" + name).toURI()).toString();
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    void loadCertificates_readsPemCertificate() throws Exception {
        List<X509Certificate> certs = TlsContextFactory.loadCertificates(fixture("ca.pem"));

        assertThat(certs).hasSize(1);
        assertThat(certs.get(0).getSubjectX500Principal().getName()).contains("vaultkit-test-ca");
    }

    @Test
    void loadCertificates_missingFile_throwsCertRead() {
        assertThatThrownBy(() -> TlsContextFactory.loadCertificates("/nonexistent/ca.pem"))
                .isInstanceOf(VaultException.class)
                .satisfies(e -> {
                    VaultException ve = (VaultException) e;
                    assertThat(ve.getKind()).isEqualTo(ErrorKind.CERT_READ);
                    assertThat(ve.getPath()).isEqualTo("/nonexistent/ca.pem");
                });
    }

    @Test
    void loadCertificates_withoutCertificate_throwsCertParse() {
        assertThatThrownBy(() -> TlsContextFactory.loadCertificates(fixture("garbage.pem")))
                .isInstanceOf(VaultException.class)
                .hasMessageContaining("no certificates found")
                .satisfies(e -> assertThat(((VaultException) e).getKind()).isEqualTo(ErrorKind.CERT_PARSE));
    }

    @Test
    void loadPrivateKey_pkcs8Rsa_succeeds() throws Exception {
        PrivateKey key = TlsContextFactory.loadPrivateKey(fixture("client-key.pem"));

        assertThat(key.getAlgorithm()).isEqualTo("RSA");
    }

    @Test
    void loadPrivateKey_pkcs8Ec_succeeds() throws Exception {
        PrivateKey key = TlsContextFactory.loadPrivateKey(fixture("ec-key.pem"));

        assertThat(key.getAlgorithm()).isEqualTo("EC");
    }

    @Test
    void loadPrivateKey_traditionalFormat_explainsConversion() {
        assertThatThrownBy(() -> TlsContextFactory.loadPrivateKey(fixture("client-key-traditional.pem")))
                .isInstanceOf(VaultException.class)
                .hasMessageContaining("openssl pkcs8")
                .satisfies(e -> assertThat(((VaultException) e).getKind()).isEqualTo(ErrorKind.CERT_PARSE));
    }

    @Test
    void loadPrivateKey_certificateFile_throwsCertParse() {
        assertThatThrownBy(() -> TlsContextFactory.loadPrivateKey(fixture("ca.pem")))
                .isInstanceOf(VaultException.class)
                .hasMessageContaining("no private key found");
    }

    private static VaultClientSettings.Builder settings() {
        return VaultClientSettings.builder()
                .environment(name -> null)
                .address("https://vault.example.com:8200");
    }

    @Test
    void create_withCaAndIdentity_createsContext() throws Exception {
        VaultClientSettings settings = settings()
                .caCerts(List.of(fixture("ca.pem")))
                .identity(fixture("client.pem"), fixture("client-key.pem"))
                .build();

        SSLContext context = TlsContextFactory.create(settings);

        assertThat(TlsContextFactory.isCustomized(settings)).isTrue();
        assertThat(context.getProtocol()).isEqualTo("TLS");
    }

    @Test
    void create_withoutVerification_createsContext() throws Exception {
        VaultClientSettings settings = settings().verify(false).build();

        assertThat(TlsContextFactory.isCustomized(settings)).isTrue();
        assertThat(TlsContextFactory.create(settings)).isNotNull();
    }

    @Test
    void trustManagers_withCaFile_keepsJdkRoots() throws Exception {
        TrustManagerFactory defaults = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        defaults.init((KeyStore) null);
        int jdkRoots = ((X509TrustManager) defaults.getTrustManagers()[0]).getAcceptedIssuers().length;

        TrustManager[] managers = TlsContextFactory.trustManagers(List.of(fixture("ca.pem")));

        assertThat(managers).hasSize(1);
        X509Certificate[] issuers = ((X509TrustManager) managers[0]).getAcceptedIssuers();
        assertThat(issuers).hasSize(jdkRoots + 1);
        assertThat(issuers).anySatisfy(issuer ->
                assertThat(issuer.getSubjectX500Principal().getName()).contains("vaultkit-test-ca"));
    }

    @Test
    void trustManagers_withoutCaFiles_usesJdkDefault() throws Exception {
        assertThat(TlsContextFactory.trustManagers(List.of())).isNull();
    }

    @Test
    void isCustomized_defaults_isFalse() throws Exception {
        assertThat(TlsContextFactory.isCustomized(settings().build())).isFalse();
    }

    @Test
    void create_withTraditionalIdentityKey_throwsCertParse() throws Exception {
        VaultClientSettings settings = settings()
                .identity(fixture("client.pem"), fixture("client-key-traditional.pem"))
                .build();

        assertThatThrownBy(() -> TlsContextFactory.create(settings))
                .isInstanceOfSatisfying(VaultException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.CERT_PARSE);
                    assertThat(e.getPath()).isEqualTo(fixture("client-key-traditional.pem"));
                });
    }

    @Test
    void vaultClient_withHttpsAndCustomCa_buildsTransport() throws Exception {
        VaultClientSettings settings = VaultClientSettings.builder()
                .environment(name -> null)
                .address("https://vault.example.com:8200")
                .caCerts(List.of(fixture("ca.pem")))
                .build();

        VaultClient client = new VaultClient(settings);

        assertThat(client.getSettings()).isSameAs(settings);
    }
}
