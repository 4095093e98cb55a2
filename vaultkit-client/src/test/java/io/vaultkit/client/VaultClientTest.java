package io.vaultkit.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vaultkit.client.api.kv1.GetSecretRequest;
import io.vaultkit.client.api.kv1.GetSecretResponse;
import io.vaultkit.client.api.kv1.SetSecretRequest;
import io.vaultkit.client.api.kv2.ReadSecretRequest;
import io.vaultkit.client.api.kv2.ReadSecretResponse;
import io.vaultkit.client.api.sys.HealthRequest;
import io.vaultkit.client.api.sys.HealthResponse;
import io.vaultkit.client.api.sys.SealStatusResponse;
import io.vaultkit.client.api.sys.WrappingLookupResponse;
import io.vaultkit.client.api.sys.WrappingWrapRequest;
import io.vaultkit.client.api.token.CreateTokenRequestBuilder;
import io.vaultkit.client.api.token.LookupTokenResponse;
import io.vaultkit.client.api.transit.EncryptRequest;
import io.vaultkit.client.api.transit.EncryptResponse;
import io.vaultkit.client.login.AuthMethodType;
import io.vaultkit.client.login.LoginMethod;
import io.vaultkit.endpoint.Endpoint;
import io.vaultkit.endpoint.RequestMethod;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VaultClientTest {

    private static final String WRAPPED = """
            {"request_id":"r-1","data":null,"wrap_info":{"token":"hvs.wrapping","accessor":"wacc","ttl":600,
             "creation_time":"2024-01-01T00:00:00Z","creation_path":"secret/app"}}
            """;

    private StubVault vault;
    private VaultClient client;

    @BeforeEach
    void setUp() throws Exception {
        vault = StubVault.start();
        client = vault.client();
    }

    @AfterEach
    void tearDown() {
        vault.close();
    }

    @Test
    void execute_returnsDecodedData() throws Exception {
        vault.on("POST", "transit/encrypt/app", 200,
                "{\"data\":{\"ciphertext\":\"vault:v1:abc\",\"key_version\":1}}");

        EncryptResponse response = client.execute(EncryptRequest.of("transit", "app", "hello"));

        assertThat(response.ciphertext()).isEqualTo("vault:v1:abc");
        assertThat(vault.lastRequest().header(VaultHttpClient.HEADER_VAULT_TOKEN)).isEqualTo(StubVault.TOKEN);
        assertThat(vault.lastRequest().body()).isEqualTo("{\"plaintext\":\"aGVsbG8=\"}");
    }

    @Test
    void execute_withVersionQuery_sendsQueryString() throws Exception {
        vault.on("GET", "secret/data/app/db", 200,
                "{\"data\":{\"data\":{\"password\":\"s3cr3t\"},\"metadata\":{\"version\":3}}}");

        ReadSecretResponse response = client.execute(new ReadSecretRequest("secret", "app/db", 3));

        assertThat(response.data()).containsEntry("password", "s3cr3t");
        assertThat(response.metadata().version()).isEqualTo(3);
        assertThat(vault.lastRequest().query()).isEqualTo("version=3");
    }

    @Test
    void execute_rawBodyEndpoint_sendsMapAsBody() throws Exception {
        vault.on("POST", "kv/app", 204, null);

        client.execute(new SetSecretRequest("kv", "app", Map.of("api_key", "k-1")));

        assertThat(vault.lastRequest().body()).isEqualTo("{\"api_key\":\"k-1\"}");
    }

    @Test
    void execute_voidEndpoint_accepts204() throws Exception {
        vault.on("POST", "kv/app", 204, null);

        Void result = client.execute(new SetSecretRequest("kv", "app", Map.of("a", "b")));

        assertThat(result).isNull();
    }

    @Test
    void execute_mapResponse_decodesWholeDataBlock() throws Exception {
        vault.on("GET", "kv/app", 200, "{\"data\":{\"api_key\":\"k-1\",\"retries\":3}}");

        GetSecretResponse secret = client.execute(new GetSecretRequest("kv", "app"));

        assertThat(secret).containsEntry("api_key", "k-1").containsEntry("retries", 3);
    }

    @Test
    void execute_emptyBodyWhenDataExpected_throwsEmptyResponse() {
        vault.on("GET", "kv/app", 204, null);

        assertThatThrownBy(() -> client.execute(new GetSecretRequest("kv", "app")))
                .isInstanceOf(VaultException.class)
                .satisfies(e -> assertThat(((VaultException) e).getKind()).isEqualTo(ErrorKind.EMPTY_RESPONSE));
    }

    @Test
    void execute_envelopeWithoutData_throwsEmptyData() {
        vault.on("GET", "kv/app", 200, "{\"request_id\":\"r-1\",\"data\":null}");

        assertThatThrownBy(() -> client.execute(new GetSecretRequest("kv", "app")))
                .isInstanceOf(VaultException.class)
                .hasMessageNotContaining("wrapped")
                .satisfies(e -> assertThat(((VaultException) e).getKind()).isEqualTo(ErrorKind.EMPTY_DATA));
    }

    @Test
    void execute_wrappedResponse_throwsEmptyDataMentioningWrap() {
        vault.on("GET", "kv/app", 200, WRAPPED);

        assertThatThrownBy(() -> client.execute(new GetSecretRequest("kv", "app")))
                .isInstanceOf(VaultException.class)
                .hasMessageContaining("wrapped")
                .satisfies(e -> assertThat(((VaultException) e).getKind()).isEqualTo(ErrorKind.EMPTY_DATA));
    }

    @Test
    void request_wrappedResponse_reportsWrapInfo() throws Exception {
        vault.on("GET", "kv/app", 200, WRAPPED);

        VaultResponse<GetSecretResponse> response = client.request(new GetSecretRequest("kv", "app"));

        assertThat(response.isWrapped()).isTrue();
        assertThat(response.getWrapInfo().token()).isEqualTo("hvs.wrapping");
        assertThat(response.getRequestId()).isEqualTo("r-1");
    }

    @Test
    void execute_apiError_propagates() {
        vault.on("GET", "kv/app", 403, "{\"errors\":[\"permission denied\"]}");

        assertThatThrownBy(() -> client.execute(new GetSecretRequest("kv", "app")))
                .isInstanceOf(VaultException.class)
                .hasMessage("permission denied");
        assertThat(vault.requests()).hasSize(1);
    }

    @Test
    void executeRaw_decodesUnenvelopedBody() throws Exception {
        vault.on("GET", "sys/health", 200,
                "{\"initialized\":true,\"sealed\":false,\"standby\":false,\"version\":\"1.21.0\"}");

        HealthResponse health = client.executeRaw(new HealthRequest(true, null));

        assertThat(health.initialized()).isTrue();
        assertThat(health.sealed()).isFalse();
        assertThat(vault.lastRequest().query()).isEqualTo("standbyok=true");
    }

    @Test
    void status_readsSealStatus() throws Exception {
        vault.on("GET", "sys/seal-status", 200,
                "{\"type\":\"shamir\",\"initialized\":true,\"sealed\":false,\"t\":3,\"n\":5,\"progress\":0}");

        SealStatusResponse status = client.status();

        assertThat(status.sealed()).isFalse();
        assertThat(status.threshold()).isEqualTo(3);
        assertThat(status.shares()).isEqualTo(5);
    }

    @Test
    void auth_returnsAuthBlockWithoutChangingToken() throws Exception {
        vault.on("POST", "auth/token/create", 200,
                "{\"auth\":{\"client_token\":\"s.child\",\"policies\":[\"default\"],\"lease_duration\":3600}}");

        AuthInfo info = client.auth(CreateTokenRequestBuilder.builder().ttl("1h").build());

        assertThat(info.clientToken()).isEqualTo("s.child");
        assertThat(client.getToken()).isEqualTo(StubVault.TOKEN);
        assertThat(vault.lastRequest().body()).isEqualTo("{\"ttl\":\"1h\"}");
    }

    @Test
    void auth_withoutAuthBlock_throwsEmptyResponse() {
        vault.on("POST", "auth/token/create", 200, "{\"data\":{}}");

        assertThatThrownBy(() -> client.auth(CreateTokenRequestBuilder.builder().build()))
                .isInstanceOf(VaultException.class)
                .satisfies(e -> assertThat(((VaultException) e).getKind()).isEqualTo(ErrorKind.EMPTY_RESPONSE));
    }

    @Test
    void login_adoptsIssuedTokenForLaterRequests() throws Exception {
        vault.on("POST", "auth/custom/login", 200, "{\"auth\":{\"client_token\":\"s.issued\"}}");
        vault.on("GET", "auth/token/lookup-self", 200, "{\"data\":{\"id\":\"s.issued\",\"policies\":[\"default\"]}}");

        AuthInfo info = client.login("custom", new CustomLogin());
        LookupTokenResponse lookup = client.lookup();

        assertThat(info.clientToken()).isEqualTo("s.issued");
        assertThat(client.getToken()).isEqualTo("s.issued");
        assertThat(lookup.policies()).containsExactly("default");
        assertThat(vault.lastRequest().header(VaultHttpClient.HEADER_VAULT_TOKEN)).isEqualTo("s.issued");
    }

    @Test
    void login_blankMount_isRejected() {
        assertThatThrownBy(() -> client.login(" ", new CustomLogin()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void login_responseWithoutToken_keepsOldToken() {
        vault.on("POST", "auth/custom/login", 200, "{\"auth\":{\"client_token\":\"\"}}");

        assertThatThrownBy(() -> client.login("custom", new CustomLogin()))
                .isInstanceOf(VaultException.class)
                .satisfies(e -> assertThat(((VaultException) e).getKind()).isEqualTo(ErrorKind.EMPTY_RESPONSE));
        assertThat(client.getToken()).isEqualTo(StubVault.TOKEN);
    }

    @Test
    void renew_returnsRenewedLease() throws Exception {
        vault.on("POST", "auth/token/renew-self", 200,
                "{\"auth\":{\"client_token\":\"s.test-token\",\"lease_duration\":7200,\"renewable\":true}}");

        AuthInfo info = client.renew("2h");

        assertThat(info.leaseDuration()).isEqualTo(7200);
        assertThat(vault.lastRequest().body()).isEqualTo("{\"increment\":\"2h\"}");
    }

    @Test
    void revoke_sendsRevokeSelf() throws Exception {
        vault.on("POST", "auth/token/revoke-self", 204, null);

        client.revoke();

        assertThat(vault.lastRequest().path()).isEqualTo("auth/token/revoke-self");
    }

    @Test
    void wrap_sendsWrapTtlAndReturnsWrappedResponse() throws Exception {
        vault.on("POST", "sys/wrapping/wrap", 200, WRAPPED);

        WrappedResponse<Void> wrapped = client.wrap(new WrappingWrapRequest(Map.of("k", "v")), "60s");

        assertThat(wrapped.getInfo().token()).isEqualTo("hvs.wrapping");
        assertThat(wrapped.getResponseType()).isEqualTo(Void.class);
        assertThat(vault.lastRequest().header(VaultHttpClient.HEADER_VAULT_WRAP_TTL)).isEqualTo("60s");
    }

    @Test
    void wrap_withoutTtl_usesDefault() throws Exception {
        vault.on("GET", "kv/app", 200, WRAPPED);

        client.wrap(new GetSecretRequest("kv", "app"));

        assertThat(vault.lastRequest().header(VaultHttpClient.HEADER_VAULT_WRAP_TTL)).isEqualTo("10m");
    }

    @Test
    void wrap_withDuration_sendsSeconds() throws Exception {
        vault.on("GET", "kv/app", 200, WRAPPED);

        client.wrap(new GetSecretRequest("kv", "app"), Duration.ofMinutes(2));

        assertThat(vault.lastRequest().header(VaultHttpClient.HEADER_VAULT_WRAP_TTL)).isEqualTo("120");
    }

    @Test
    void wrap_blankTtl_isRejectedBeforeSending() {
        assertThatThrownBy(() -> client.wrap(new GetSecretRequest("kv", "app"), " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(vault.requests()).isEmpty();
    }

    @Test
    void wrap_unwrappedReply_throwsEmptyData() {
        vault.on("GET", "kv/app", 200, "{\"data\":{\"a\":\"b\"}}");

        assertThatThrownBy(() -> client.wrap(new GetSecretRequest("kv", "app")))
                .isInstanceOf(VaultException.class)
                .hasMessageContaining("not wrapped")
                .satisfies(e -> assertThat(((VaultException) e).getKind()).isEqualTo(ErrorKind.EMPTY_DATA));
    }

    @Test
    void wrapLookup_returnsMetadata() throws Exception {
        vault.on("POST", "sys/wrapping/lookup", 200,
                "{\"data\":{\"creation_path\":\"secret/app\",\"creation_time\":\"2024-01-01T00:00:00Z\",\"creation_ttl\":600}}");

        WrappingLookupResponse lookup = client.wrapLookup(wrapInfo());

        assertThat(lookup.creationPath()).isEqualTo("secret/app");
        assertThat(vault.lastRequest().body()).isEqualTo("{\"token\":\"hvs.wrapping\"}");
    }

    @Test
    void wrapLookup_consumedToken_isWrapInvalid() {
        vault.on("POST", "sys/wrapping/lookup", 400, "{\"errors\":[\"wrapping token is not valid or does not exist\"]}");

        assertThatThrownBy(() -> client.wrapLookup(wrapInfo()))
                .isInstanceOfSatisfying(VaultException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.WRAP_INVALID);
                    assertThat(e.getHttpStatusCode()).isEqualTo(400);
                });
    }

    @Test
    void unwrap_decodesPayloadAsRequestedType() throws Exception {
        vault.on("POST", "sys/wrapping/unwrap", 200, "{\"data\":{\"api_key\":\"k-1\"}}");

        GetSecretResponse secret = client.unwrap(wrapInfo(), GetSecretResponse.class);

        assertThat(secret).containsEntry("api_key", "k-1");
    }

    @Test
    void unwrap_invalidToken_throwsWrapInvalid() {
        vault.on("POST", "sys/wrapping/unwrap", 400, "{\"errors\":[\"wrapping token is not valid or does not exist\"]}");

        assertThatThrownBy(() -> client.unwrap(wrapInfo(), GetSecretResponse.class))
                .isInstanceOf(VaultException.class)
                .satisfies(e -> {
                    VaultException ve = (VaultException) e;
                    assertThat(ve.getKind()).isEqualTo(ErrorKind.WRAP_INVALID);
                    assertThat(ve.getHttpStatusCode()).isEqualTo(400);
                });
    }

    @Test
    void unwrap_otherApiError_isNotReclassified() {
        vault.on("POST", "sys/wrapping/unwrap", 403, "{\"errors\":[\"permission denied\"]}");

        assertThatThrownBy(() -> client.unwrap(wrapInfo(), GetSecretResponse.class))
                .isInstanceOf(VaultException.class)
                .satisfies(e -> assertThat(((VaultException) e).getKind()).isEqualTo(ErrorKind.API));
    }

    @Test
    void setToken_null_sendsNoToken() throws Exception {
        vault.on("GET", "sys/seal-status", 200, "{\"sealed\":false}");
        client.setToken(null);

        client.status();

        assertThat(client.getToken()).isEmpty();
        assertThat(vault.lastRequest().header(VaultHttpClient.HEADER_VAULT_TOKEN)).isNull();
    }

    /** Logs in through {@code auth/<mount>/login} without credentials. */
    private static final class CustomLogin implements LoginMethod {

        @Override
        public AuthMethodType getAuthMethod() {
            return AuthMethodType.USERPASS;
        }

        @Override
        public AuthInfo login(VaultClient client, String mount) throws VaultException {
            return client.auth(new CustomLoginRequest(mount));
        }
    }

    private record CustomLoginRequest(String mount) implements Endpoint<Void> {

        @Override
        public RequestMethod requestMethod() {
            return RequestMethod.POST;
        }

        @Override
        public String requestPath() {
            return "auth/" + mount + "/login";
        }

        @Override
        public Class<Void> responseType() {
            return Void.class;
        }
    }

    private static WrapInfo wrapInfo() {
        return new WrapInfo("hvs.wrapping", "wacc", 600, "2024-01-01T00:00:00Z", "secret/app", null);
    }
}
