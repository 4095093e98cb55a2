package io.vaultkit.client.login;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.vaultkit.client.AuthInfo;
import io.vaultkit.client.ErrorKind;
import io.vaultkit.client.StubVault;
import io.vaultkit.client.VaultClient;
import io.vaultkit.client.VaultException;
import io.vaultkit.client.api.auth.approle.AppRoleLoginRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for AppRoleLogin.
 */
class AppRoleLoginTest {

    private static final String LOGIN_REPLY = "{\"auth\":{\"client_token\":\"s.approle\",\"lease_duration\":3600}}";

    @TempDir
    Path tempDir;

    private final Map<String, String> env = new HashMap<>();
    private StubVault vault;
    private VaultClient client;

    @BeforeEach
    void setUp() throws Exception {
        vault = StubVault.start();
        client = vault.client();
        vault.on("POST", "auth/approle/login", 200, LOGIN_REPLY);
    }

    @AfterEach
    void tearDown() {
        vault.close();
    }

    @Test
    void of_withStaticSecret_succeeds() {
        AppRoleLogin login = AppRoleLogin.of("role-123", "secret-456");

        assertThat(login.getAuthMethod()).isEqualTo(AuthMethodType.APPROLE);
        assertThat(login.getRoleId()).isEqualTo("role-123");
        assertThat(login.getSecretSource()).isEqualTo("static secret ID");
    }

    @Test
    void of_withNullRoleId_throwsException() {
        assertThatThrownBy(() -> AppRoleLogin.of(null, "secret"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Role ID");
    }

    @Test
    void of_withBlankSecretId_throwsException() {
        assertThatThrownBy(() -> AppRoleLogin.of("role", " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Secret ID");
    }

    @Test
    void login_sendsRoleAndSecretAndAdoptsToken() throws Exception {
        AuthInfo info = client.login(AppRoleLogin.of("role-123", "secret-456"));

        assertThat(info.clientToken()).isEqualTo("s.approle");
        assertThat(client.getToken()).isEqualTo("s.approle");
        assertThat(vault.lastRequest().path()).isEqualTo("auth/approle/login");
        assertThat(vault.lastRequest().body()).isEqualTo("{\"role_id\":\"role-123\",\"secret_id\":\"secret-456\"}");
    }

    @Test
    void login_withMockClient_delegatesToAuth() throws Exception {
        VaultClient mockClient = mock(VaultClient.class);
        AuthInfo issued = new AuthInfo("s.mocked", null, List.of("default"), null, null, 60, true, null, null, false);
        when(mockClient.auth(new AppRoleLoginRequest("approle", "role-123", "secret-456"))).thenReturn(issued);

        AuthInfo info = AppRoleLogin.of("role-123", "secret-456").login(mockClient, "approle");

        assertThat(info).isSameAs(issued);
        verify(mockClient).auth(new AppRoleLoginRequest("approle", "role-123", "secret-456"));
    }

    @Test
    void login_withUnreadableSecret_neverCallsVault() throws Exception {
        VaultClient mockClient = mock(VaultClient.class);
        AppRoleLogin login = AppRoleLogin.fromEnvironment("role", "VAULT_SECRET_ID", env::get);

        assertThatThrownBy(() -> login.login(mockClient, "approle"))
                .isInstanceOf(SecurityException.class);
        verify(mockClient, never()).auth(any());
    }

    @Test
    void login_atCustomMount_usesMountPath() throws Exception {
        vault.on("POST", "auth/machines/login", 200, LOGIN_REPLY);

        client.login("machines", AppRoleLogin.of("role-123", "secret-456"));

        assertThat(vault.lastRequest().path()).isEqualTo("auth/machines/login");
    }

    @Test
    void login_withSecretFile_rereadsFileEachTime() throws Exception {
        Path secretFile = tempDir.resolve("secret-id");
        Files.writeString(secretFile, "first-secret\n");
        AppRoleLogin login = AppRoleLogin.fromFile("role-123", secretFile);

        client.login(login);
        Files.writeString(secretFile, "rotated-secret");
        client.login(login);

        assertThat(vault.requests()).extracting(StubVault.RecordedRequest::body).containsExactly(
                "{\"role_id\":\"role-123\",\"secret_id\":\"first-secret\"}",
                "{\"role_id\":\"role-123\",\"secret_id\":\"rotated-secret\"}");
        assertThat(login.getSecretSource()).contains(secretFile.toString());
    }

    @Test
    void login_withEmptySecretFile_throwsSecurityException() throws Exception {
        Path secretFile = tempDir.resolve("secret-id");
        Files.writeString(secretFile, "  \n");

        assertThatThrownBy(() -> client.login(AppRoleLogin.fromFile("role", secretFile)))
                .isInstanceOf(SecurityException.class)
                .hasMessageContaining("empty");
        assertThat(vault.requests()).isEmpty();
    }

    @Test
    void login_withMissingSecretFile_throwsSecurityException() {
        Path missing = tempDir.resolve("missing");

        assertThatThrownBy(() -> client.login(AppRoleLogin.fromFile("role", missing)))
                .isInstanceOf(SecurityException.class)
                .hasMessageContaining("Cannot read secret file");
    }

    @Test
    void login_withEnvironmentVariable_rereadsVariable() throws Exception {
        env.put("VAULT_SECRET_ID", "env-secret-1");
        AppRoleLogin login = AppRoleLogin.fromEnvironment("role-123", "VAULT_SECRET_ID", env::get);

        client.login(login);
        env.put("VAULT_SECRET_ID", "env-secret-2");
        client.login(login);

        assertThat(vault.requests()).extracting(StubVault.RecordedRequest::body).containsExactly(
                "{\"role_id\":\"role-123\",\"secret_id\":\"env-secret-1\"}",
                "{\"role_id\":\"role-123\",\"secret_id\":\"env-secret-2\"}");
    }

    @Test
    void login_withUnsetEnvironmentVariable_throwsSecurityException() {
        AppRoleLogin login = AppRoleLogin.fromEnvironment("role", "VAULT_SECRET_ID", env::get);

        assertThatThrownBy(() -> client.login(login))
                .isInstanceOf(SecurityException.class)
                .hasMessageContaining("VAULT_SECRET_ID");
    }

    @Test
    void login_rejectedCredentials_throwsApiErrorAndKeepsToken() throws Exception {
        try (StubVault rejecting = StubVault.start()) {
            rejecting.on("POST", "auth/approle/login", 400, "{\"errors\":[\"invalid role or secret ID\"]}");
            VaultClient fresh = rejecting.client();

            assertThatThrownBy(() -> fresh.login(AppRoleLogin.of("role", "wrong")))
                    .isInstanceOfSatisfying(VaultException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.API);
                        assertThat(e.getHttpStatusCode()).isEqualTo(400);
                    })
                    .hasMessage("invalid role or secret ID");
            assertThat(fresh.getToken()).isEqualTo(StubVault.TOKEN);
        }
    }

    @Test
    void create_prefersReadableFile() throws Exception {
        Path secretFile = tempDir.resolve("secret-id");
        Files.writeString(secretFile, "file-secret");
        env.put("VAULT_SECRET_ID", "env-secret");

        AppRoleLogin login = AppRoleLogin.create("role", "VAULT_SECRET_ID", secretFile.toString(), env::get);

        assertThat(login.getSecretSource()).startsWith("secret file");
    }

    @Test
    void create_fallsBackToEnvironmentWhenFileMissing() {
        env.put("VAULT_SECRET_ID", "env-secret");

        AppRoleLogin login = AppRoleLogin.create("role", "VAULT_SECRET_ID",
                tempDir.resolve("missing").toString(), env::get);

        assertThat(login.getSecretSource()).isEqualTo("VAULT_SECRET_ID environment variable");
    }

    @Test
    void create_withoutAnySource_throwsSecurityException() {
        assertThatThrownBy(() -> AppRoleLogin.create("role", "VAULT_SECRET_ID", null, env::get))
                .isInstanceOf(SecurityException.class)
                .hasMessageContaining("VAULT_SECRET_ID");
    }

    @Test
    void create_withoutRoleId_throwsSecurityException() {
        assertThatThrownBy(() -> AppRoleLogin.create(" ", "VAULT_SECRET_ID", null, env::get))
                .isInstanceOf(SecurityException.class)
                .hasMessageContaining("role ID");
    }

    @Test
    void toString_doesNotLeakSecret() {
        assertThat(AppRoleLogin.of("role-123", "secret-456").toString()).doesNotContain("secret-456");
    }
}
