package cloud.graphauth.sdk.auth;

import cloud.graphauth.sdk.AuthRequiredException;
import cloud.graphauth.sdk.ConfigException;
import cloud.graphauth.sdk.FailureKind;
import cloud.graphauth.sdk.ProviderConfig;
import cloud.graphauth.sdk.ProviderException;
import cloud.graphauth.sdk.TokenBundle;
import cloud.graphauth.sdk.TokenResult;
import cloud.graphauth.sdk.callback.ArtifactCookie;
import cloud.graphauth.sdk.crypto.SharedSecret;
import cloud.graphauth.sdk.crypto.TokenCodec;
import cloud.graphauth.sdk.testsupport.StubTokenEndpoint;
import cloud.graphauth.sdk.testsupport.StubTokenEndpoint.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenSupplierTest {

    private static final Instant T0 = Instant.parse("2025-08-25T12:00:00Z");
    private static final SharedSecret SECRET = SharedSecret.of("webui-secret");

    private StubTokenEndpoint endpoint;
    private ProviderConfig config;
    private TokenCodec codec;
    private TokenSupplier supplier;

    @BeforeEach
    void setUp() throws IOException {
        endpoint = new StubTokenEndpoint();
        config = ProviderConfig.builder()
            .tenantId("tenant-1")
            .clientId("client-id")
            .clientSecret("client-secret")
            .defaultScopes(List.of("User.Read", "Files.Read"))
            .tokenEndpoint(endpoint.url())
            .build();
        codec = new TokenCodec(SECRET);
        supplier = newSupplier(Clock.fixed(T0, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        endpoint.close();
    }

    @Test
    void returnsProviderAccessTokenUnchanged() throws Exception {
        endpoint.respondWith((form, attempt) -> "RT1".equals(form.get("refresh_token"))
            ? Reply.ok(Map.of("access_token", "AT1", "expires_in", 3600))
            : Reply.error(400, Map.of("error", "invalid_grant")));
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), T0)).toCookieValue();

        TokenResult result = supplier.getAccessToken(artifact);

        assertTrue(result.isSuccess());
        assertEquals(new AccessToken("AT1", T0.plusSeconds(3600)), result.orElseThrow());
        assertFalse(result.getRotatedBundle().isPresent());
        assertEquals("Files.Read", endpoint.requests().get(0).get("scope"));
    }

    @Test
    void absentArtifactRequiresAuthentication() {
        TokenResult missing = supplier.getAccessToken(null);
        TokenResult blank = supplier.getAccessToken("  ");

        assertEquals(FailureKind.AUTH_REQUIRED, missing.getFailure().orElseThrow());
        assertEquals(FailureKind.AUTH_REQUIRED, blank.getFailure().orElseThrow());
        assertTrue(endpoint.requests().isEmpty());
        assertThrows(AuthRequiredException.class, missing::orElseThrow);
        assertTrue(missing.userMessage().contains("Sign in"));
    }

    @Test
    void undecodableArtifactRequiresAuthentication() {
        String foreign = new TokenCodec(SharedSecret.of("other-secret"))
            .encode(new TokenBundle("RT1", List.of(), T0)).toCookieValue();

        assertEquals(FailureKind.AUTH_REQUIRED, supplier.getAccessToken(foreign).getFailure().orElseThrow());
        assertEquals(FailureKind.AUTH_REQUIRED, supplier.getAccessToken("garbage!").getFailure().orElseThrow());
        assertTrue(endpoint.requests().isEmpty());
    }

    @Test
    void expiredRefreshTokenRequiresAuthenticationWithoutRetry() {
        endpoint.respondWith((form, attempt) -> Reply.error(400, Map.of(
            "error", "invalid_grant",
            "error_description", "AADSTS700082: The refresh token has expired due to inactivity.",
            "error_codes", List.of(700082))));
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), T0)).toCookieValue();

        TokenResult result = supplier.getAccessToken(artifact);

        assertEquals(FailureKind.AUTH_REQUIRED, result.getFailure().orElseThrow());
        assertTrue(result.getDiagnostic().contains("AADSTS700082"));
        assertEquals(1, endpoint.requests().size());
    }

    @Test
    void scopeRejectionRetriesWithoutScope() throws Exception {
        endpoint.respondWith((form, attempt) -> form.containsKey("scope")
            ? Reply.error(400, Map.of("error", "invalid_scope", "error_codes", List.of(70011)))
            : Reply.ok(Map.of("access_token", "AT-retry", "expires_in", 3600)));
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), T0)).toCookieValue();

        TokenResult result = supplier.getAccessToken(artifact);

        assertEquals("AT-retry", result.orElseThrow().getValue());
        assertEquals(2, endpoint.requests().size());
    }

    @Test
    void persistentConsentFailureRequiresAuthentication() {
        endpoint.respondWith((form, attempt) -> Reply.error(400, Map.of("error", "invalid_grant", "error_codes", List.of(65001))));
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), T0)).toCookieValue();

        assertEquals(FailureKind.AUTH_REQUIRED, supplier.getAccessToken(artifact).getFailure().orElseThrow());
    }

    @Test
    void rejectedClientIsConfigurationError() {
        endpoint.respondWith((form, attempt) -> Reply.error(401, Map.of("error", "invalid_client", "error_codes", List.of(7000222))));
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), T0)).toCookieValue();

        TokenResult result = supplier.getAccessToken(artifact);

        assertEquals(FailureKind.CONFIG_ERROR, result.getFailure().orElseThrow());
        assertThrows(ConfigException.class, result::orElseThrow);
        assertFalse(result.userMessage().contains("invalid_client"));
    }

    @Test
    void malformedRequestIsFatalProviderError() {
        endpoint.respondWith((form, attempt) -> Reply.error(400, Map.of("error", "invalid_request")));
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), T0)).toCookieValue();

        TokenResult result = supplier.getAccessToken(artifact);

        assertEquals(FailureKind.PROVIDER_FATAL, result.getFailure().orElseThrow());
        ProviderException ex = assertThrows(ProviderException.class, result::orElseThrow);
        assertEquals(cloud.graphauth.sdk.ProviderErrorKind.FATAL, ex.getKind());
    }

    @Test
    void serverErrorIsTransient() {
        endpoint.respondWith((form, attempt) -> Reply.error(502, Map.of()));
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), T0)).toCookieValue();

        TokenResult result = supplier.getAccessToken(artifact);

        assertEquals(FailureKind.PROVIDER_TRANSIENT, result.getFailure().orElseThrow());
        assertEquals(1, endpoint.requests().size());
    }

    @Test
    void fallsBackToDefaultScopesForBundlesWithoutScopes() {
        String artifact = codec.encode(new TokenBundle("RT1", List.of(), T0)).toCookieValue();

        supplier.getAccessToken(artifact);

        assertEquals("User.Read Files.Read", endpoint.requests().get(0).get("scope"));
    }

    @Test
    void staleArtifactRequiresAuthentication() {
        String artifact = codec.encode(new TokenBundle("RT1", List.of(), T0)).toCookieValue();
        TokenSupplier later = newSupplier(Clock.fixed(T0.plus(Duration.ofDays(91)), ZoneOffset.UTC));
        TokenSupplier earlier = newSupplier(Clock.fixed(T0.minus(Duration.ofHours(1)), ZoneOffset.UTC));

        assertEquals(FailureKind.AUTH_REQUIRED, later.getAccessToken(artifact).getFailure().orElseThrow());
        assertEquals(FailureKind.AUTH_REQUIRED, earlier.getAccessToken(artifact).getFailure().orElseThrow());
        assertTrue(endpoint.requests().isEmpty());
    }

    @Test
    void extremeMaxAgeComparesWithoutOverflow() throws Exception {
        endpoint.respondWith((form, attempt) -> Reply.ok(Map.of("access_token", "AT1", "expires_in", 3600)));
        ProviderConfig unbounded = ProviderConfig.builder()
            .tenantId("tenant-1")
            .clientId("client-id")
            .clientSecret("client-secret")
            .defaultScopes(List.of("User.Read"))
            .tokenEndpoint(endpoint.url())
            .artifactMaxAge(Duration.ofSeconds(Long.MAX_VALUE))
            .build();
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        TokenSupplier lenient = new TokenSupplier(unbounded, codec, new ProviderClient(unbounded, clock), clock);
        String ancient = codec.encode(new TokenBundle("RT1", List.of(), Instant.parse("0001-01-01T00:00:00Z"))).toCookieValue();

        TokenResult result = lenient.getAccessToken(ancient);

        assertEquals("AT1", result.orElseThrow().getValue());
        assertEquals(FailureKind.AUTH_REQUIRED, supplier.getAccessToken(ancient).getFailure().orElseThrow());
    }

    @Test
    void oversizedExpiresInIsClampedToOneDay() throws Exception {
        endpoint.respondWith((form, attempt) -> Reply.ok(Map.of("access_token", "AT1", "expires_in", Long.MAX_VALUE)));
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), T0)).toCookieValue();

        TokenResult result = supplier.getAccessToken(artifact);

        assertEquals(T0.plus(Duration.ofDays(1)), result.orElseThrow().getExpiresAt());
    }

    @Test
    void nonStringAccessTokenIsFatalProviderError() {
        endpoint.respondWith((form, attempt) -> Reply.ok(Map.of("access_token", 12345, "expires_in", 3600)));
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), T0)).toCookieValue();

        assertEquals(FailureKind.PROVIDER_FATAL, supplier.getAccessToken(artifact).getFailure().orElseThrow());
    }

    @Test
    void surfacesRotatedBundleWithoutTouchingOriginal() throws Exception {
        endpoint.respondWith((form, attempt) -> Reply.ok(Map.of(
            "access_token", "AT1",
            "refresh_token", "RT2",
            "scope", "Files.Read User.Read",
            "expires_in", 3600)));
        TokenBundle original = new TokenBundle("RT1", List.of("Files.Read"), T0.minusSeconds(60));
        String artifact = codec.encode(original).toCookieValue();

        TokenResult result = supplier.getAccessToken(artifact);

        TokenBundle rotated = result.getRotatedBundle().orElseThrow();
        assertEquals("RT2", rotated.getRefreshToken());
        assertEquals(List.of("Files.Read", "User.Read"), rotated.getScopes());
        assertEquals(T0, rotated.getIssuedAt());
        assertEquals(original, codec.decode(artifact));
    }

    @Test
    void unchangedRefreshTokenIsNotReportedAsRotation() {
        endpoint.respondWith((form, attempt) -> Reply.ok(Map.of("access_token", "AT1", "refresh_token", "RT1", "expires_in", 3600)));
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), T0)).toCookieValue();

        assertFalse(supplier.getAccessToken(artifact).getRotatedBundle().isPresent());
    }

    @Test
    void writesReplacementArtifactToSinkOnRotation() throws Exception {
        endpoint.respondWith((form, attempt) -> Reply.ok(Map.of("access_token", "AT1", "refresh_token", "RT2", "expires_in", 3600)));
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), T0)).toCookieValue();
        List<ArtifactCookie> stored = new ArrayList<>();

        TokenResult result = supplier.getAccessToken(artifact, stored::add);

        assertTrue(result.isSuccess());
        assertEquals(1, stored.size());
        assertEquals("ms_graph", stored.get(0).getName());
        assertEquals("RT2", codec.decode(stored.get(0).getValue()).getRefreshToken());
    }

    @Test
    void sinkUntouchedWithoutRotationOrOnFailure() {
        List<ArtifactCookie> stored = new ArrayList<>();
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), T0)).toCookieValue();

        supplier.getAccessToken(artifact, stored::add);
        supplier.getAccessToken(null, stored::add);

        assertTrue(stored.isEmpty());
    }

    @Test
    void independentInstancesServeSameArtifactConcurrently() throws Exception {
        CountDownLatch bothArrived = new CountDownLatch(2);
        endpoint.respondWith((form, attempt) -> {
            bothArrived.countDown();
            bothArrived.await(5, TimeUnit.SECONDS);
            return Reply.ok(Map.of("access_token", "AT-" + attempt, "expires_in", 3600));
        });
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), Instant.now())).toCookieValue();

        TokenSupplier replicaA = new TokenSupplier(config, new TokenCodec(SECRET), new ProviderClient(config));
        TokenSupplier replicaB = new TokenSupplier(config, new TokenCodec(SECRET), new ProviderClient(config));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Callable<TokenResult> callA = () -> replicaA.getAccessToken(artifact);
            Callable<TokenResult> callB = () -> replicaB.getAccessToken(artifact);
            Future<TokenResult> first = pool.submit(callA);
            Future<TokenResult> second = pool.submit(callB);

            AccessToken a = first.get(10, TimeUnit.SECONDS).orElseThrow();
            AccessToken b = second.get(10, TimeUnit.SECONDS).orElseThrow();

            assertTrue(a.getValue().startsWith("AT-"));
            assertTrue(b.getValue().startsWith("AT-"));
            assertEquals(0, bothArrived.getCount());
            assertEquals(2, endpoint.requests().size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void neverCachesAccessTokens() throws Exception {
        String artifact = codec.encode(new TokenBundle("RT1", List.of("Files.Read"), T0)).toCookieValue();

        String first = supplier.getAccessToken(artifact).orElseThrow().getValue();
        String second = supplier.getAccessToken(artifact).orElseThrow().getValue();

        assertEquals("AT-1", first);
        assertEquals("AT-2", second);
    }

    private TokenSupplier newSupplier(Clock clock) {
        return new TokenSupplier(config, codec, new ProviderClient(config, clock), clock);
    }
}
