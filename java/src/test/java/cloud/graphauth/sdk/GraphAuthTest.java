package cloud.graphauth.sdk;

import cloud.graphauth.sdk.callback.ArtifactCookie;
import cloud.graphauth.sdk.callback.AuthenticationEvent;
import cloud.graphauth.sdk.callback.AuthenticationHookRegistry;
import cloud.graphauth.sdk.crypto.SharedSecret;
import cloud.graphauth.sdk.testsupport.StubTokenEndpoint;
import cloud.graphauth.sdk.testsupport.StubTokenEndpoint.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphAuthTest {

    private StubTokenEndpoint endpoint;

    @BeforeEach
    void setUp() throws IOException {
        endpoint = new StubTokenEndpoint();
    }

    @AfterEach
    void tearDown() {
        endpoint.close();
    }

    @Test
    void loginThenCallThenRotateThenLogout() throws Exception {
        GraphAuth auth = new GraphAuth(config(), SharedSecret.of("webui-secret"));
        AuthenticationHookRegistry hooks = new AuthenticationHookRegistry();
        assertTrue(auth.install(hooks));

        List<ArtifactCookie> loginResponse = new ArrayList<>();
        hooks.fire(new AuthenticationEvent("microsoft", Map.of(
            "access_token", "host-token",
            "refresh_token", "RT1",
            "scope", "Files.Read offline_access"), loginResponse::add));
        String cookie = loginResponse.get(0).getValue();

        endpoint.respondWith((form, attempt) -> Reply.ok(Map.of(
            "access_token", "AT-" + attempt,
            "refresh_token", "RT" + (attempt + 1),
            "expires_in", 3600)));

        List<ArtifactCookie> callResponse = new ArrayList<>();
        TokenResult result = auth.getAccessToken(cookie, callResponse::add);

        assertEquals("AT-1", result.orElseThrow().getValue());
        assertEquals("RT1", endpoint.requests().get(0).get("refresh_token"));
        assertEquals("Files.Read offline_access", endpoint.requests().get(0).get("scope"));
        assertEquals(1, callResponse.size());

        TokenResult next = auth.getAccessToken(callResponse.get(0).getValue());
        assertEquals("AT-2", next.orElseThrow().getValue());
        assertEquals("RT2", endpoint.requests().get(1).get("refresh_token"));

        List<ArtifactCookie> logoutResponse = new ArrayList<>();
        auth.logout(logoutResponse::add);
        assertTrue(logoutResponse.get(0).isExpired());
        assertEquals("ms_graph", logoutResponse.get(0).getName());
    }

    @Test
    void replicasWithSameSecretAreInterchangeable() throws Exception {
        GraphAuth login = new GraphAuth(config(), SharedSecret.of("webui-secret"));
        GraphAuth replica = new GraphAuth(config(), SharedSecret.of("webui-secret"));
        GraphAuth rotatedSecret = new GraphAuth(config(), SharedSecret.of("new-secret"));

        List<ArtifactCookie> stored = new ArrayList<>();
        login.getInterceptor().onAuthenticated(new AuthenticationEvent("microsoft", Map.of("refresh_token", "RT1"), stored::add));
        String cookie = stored.get(0).getValue();

        assertTrue(replica.getAccessToken(cookie).isSuccess());
        assertEquals(FailureKind.AUTH_REQUIRED, rotatedSecret.getAccessToken(cookie).getFailure().orElseThrow());
    }

    @Test
    void refusesToStartWithIncompleteEnvironment() {
        Map<String, String> env = Map.of(
            ProviderConfig.ENV_TENANT_ID, "tenant-1",
            ProviderConfig.ENV_CLIENT_ID, "client-id",
            ProviderConfig.ENV_CLIENT_SECRET, "client-secret",
            ProviderConfig.ENV_SCOPES, "User.Read");

        ConfigException ex = assertThrows(ConfigException.class, () -> GraphAuth.fromEnvironment(env));
        assertTrue(ex.getMessage().contains(SharedSecret.ENV_SECRET));
    }

    @Test
    void buildsFromCompleteEnvironment() throws Exception {
        Map<String, String> env = Map.of(
            ProviderConfig.ENV_TENANT_ID, "tenant-1",
            ProviderConfig.ENV_CLIENT_ID, "client-id",
            ProviderConfig.ENV_CLIENT_SECRET, "client-secret",
            ProviderConfig.ENV_SCOPES, "User.Read Files.Read",
            SharedSecret.ENV_SECRET, "webui-secret");

        GraphAuth auth = GraphAuth.fromEnvironment(env);

        assertEquals(List.of("User.Read", "Files.Read"), auth.getConfig().getDefaultScopes());
        assertEquals(FailureKind.AUTH_REQUIRED, auth.getAccessToken(null).getFailure().orElseThrow());
    }

    private ProviderConfig config() {
        return ProviderConfig.builder()
            .tenantId("tenant-1")
            .clientId("client-id")
            .clientSecret("client-secret")
            .defaultScopes(List.of("User.Read"))
            .tokenEndpoint(endpoint.url())
            .build();
    }
}
