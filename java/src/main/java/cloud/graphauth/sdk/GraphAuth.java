package cloud.graphauth.sdk;

import cloud.graphauth.sdk.auth.ProviderClient;
import cloud.graphauth.sdk.auth.TokenSupplier;
import cloud.graphauth.sdk.callback.ArtifactCookie;
import cloud.graphauth.sdk.callback.ArtifactSink;
import cloud.graphauth.sdk.callback.AuthenticationHooks;
import cloud.graphauth.sdk.callback.CallbackInterceptor;
import cloud.graphauth.sdk.crypto.SharedSecret;
import cloud.graphauth.sdk.crypto.TokenCodec;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point: wires the codec, provider client, callback interceptor and token supplier from one
 * {@link ProviderConfig} and one {@link SharedSecret}. Create a single instance per process at startup and share it;
 * it is immutable and thread-safe.
 * </p>
 *
 * <h2>Typical use</h2>
 * <ol>
 *   <li>At startup, {@link #fromEnvironment()} (refuses to start on missing configuration) and
 *       {@link #install(AuthenticationHooks)} against the host's login callback.</li>
 *   <li>Before every downstream API call, {@link #getAccessToken(String, ArtifactSink)} with the request's cookie
 *       value and the outgoing response as sink. Use the token for that call only.</li>
 *   <li>On logout, {@link #logout(ArtifactSink)}.</li>
 * </ol>
 *
 * <p>
 * No token is ever held server-side. Replicas configured with the same secret are interchangeable.
 * </p>
 */
public final class GraphAuth {

    private static final Logger LOGGER = Logger.getLogger(GraphAuth.class.getName());

    private final ProviderConfig config;
    private final TokenCodec codec;
    private final ProviderClient providerClient;
    private final CallbackInterceptor interceptor;
    private final TokenSupplier supplier;

    public GraphAuth(ProviderConfig config, SharedSecret secret) {
        this(config, secret, Clock.systemUTC());
    }

    public GraphAuth(ProviderConfig config, SharedSecret secret, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(secret, "secret");
        Objects.requireNonNull(clock, "clock");
        this.codec = new TokenCodec(secret);
        this.providerClient = new ProviderClient(config, clock);
        this.interceptor = new CallbackInterceptor(config, codec, clock);
        this.supplier = new TokenSupplier(config, codec, providerClient, clock);
    }

    /**
     * Builds an instance from the process environment.
     *
     * @throws ConfigException when any required variable is missing; the host must not start degraded.
     */
    public static GraphAuth fromEnvironment() throws ConfigException {
        return fromEnvironment(System.getenv());
    }

    public static GraphAuth fromEnvironment(Map<String, String> env) throws ConfigException {
        Objects.requireNonNull(env, "env");
        ProviderConfig config = ProviderConfig.fromEnvironment(env);
        SharedSecret secret = SharedSecret.fromEnvironment(env);
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[graphauth-sdk] configured tenant=%s client=%s scopes=%s endpoint=%s",
            config.getTenantId(), config.getClientId(), config.getDefaultScopes(), config.getTokenEndpoint()));
        return new GraphAuth(config, secret);
    }

    /**
     * Registers the callback interceptor with the host; idempotent per hooks instance.
     */
    public boolean install(AuthenticationHooks hooks) {
        return interceptor.install(hooks);
    }

    public TokenResult getAccessToken(String storedArtifact) {
        return supplier.getAccessToken(storedArtifact);
    }

    /**
     * Obtains an access token and writes a replacement artifact to {@code sink} if the refresh token was rotated.
     */
    public TokenResult getAccessToken(String storedArtifact, ArtifactSink sink) {
        return supplier.getAccessToken(storedArtifact, sink);
    }

    /**
     * Tells the client to discard its artifact. This is the only way a bundle is destroyed.
     */
    public void logout(ArtifactSink sink) {
        Objects.requireNonNull(sink, "sink").store(ArtifactCookie.expired(config.getCookieName()));
    }

    public ProviderConfig getConfig() {
        return config;
    }

    public TokenCodec getCodec() {
        return codec;
    }

    public ProviderClient getProviderClient() {
        return providerClient;
    }

    public CallbackInterceptor getInterceptor() {
        return interceptor;
    }

    public TokenSupplier getSupplier() {
        return supplier;
    }
}
