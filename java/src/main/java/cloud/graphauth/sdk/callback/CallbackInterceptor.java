package cloud.graphauth.sdk.callback;

import cloud.graphauth.sdk.ConfigException;
import cloud.graphauth.sdk.ProviderConfig;
import cloud.graphauth.sdk.TokenBundle;
import cloud.graphauth.sdk.crypto.EncryptedArtifact;
import cloud.graphauth.sdk.crypto.TokenCodec;
import cloud.graphauth.sdk.internal.Scopes;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Captures the provider's refresh token at login and hands the encrypted artifact to the login response.
 *
 * <p>
 * Only the refresh token and the granted scopes are kept; access and ID tokens belong to the host. A login that
 * did not grant a refresh token is reported as a {@link ConfigException}, since it means offline access is not
 * configured for the application.
 * </p>
 */
public final class CallbackInterceptor implements AuthenticationListener {

    private static final Logger LOGGER = Logger.getLogger(CallbackInterceptor.class.getName());

    private final ProviderConfig config;
    private final TokenCodec codec;
    private final Clock clock;
    private final Set<AuthenticationHooks> installedOn = Collections.newSetFromMap(new IdentityHashMap<>());

    public CallbackInterceptor(ProviderConfig config, TokenCodec codec) {
        this(config, codec, Clock.systemUTC());
    }

    public CallbackInterceptor(ProviderConfig config, TokenCodec codec, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers this interceptor with the host. Repeated calls for the same hooks instance are no-ops.
     *
     * @return {@code true} when the interceptor was newly registered.
     */
    public boolean install(AuthenticationHooks hooks) {
        Objects.requireNonNull(hooks, "hooks");
        synchronized (installedOn) {
            if (!installedOn.add(hooks)) {
                return false;
            }
        }
        hooks.register(this);
        LOGGER.fine(() -> "[graphauth-sdk] callback interceptor installed for provider " + config.getProviderId());
        return true;
    }

    @Override
    public void onAuthenticated(AuthenticationEvent event) throws ConfigException {
        if (!config.getProviderId().equalsIgnoreCase(event.providerId())) {
            return;
        }

        TokenBundle bundle = bundleFrom(event);
        EncryptedArtifact artifact = codec.encode(bundle);
        event.sink().store(ArtifactCookie.of(config.getCookieName(), artifact, config.getArtifactMaxAge()));

        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[graphauth-sdk] stored refresh token artifact (%d scope(s), %d bytes)",
            bundle.getScopes().size(), artifact.length()));
    }

    TokenBundle bundleFrom(AuthenticationEvent event) throws ConfigException {
        Object refreshToken = event.tokenResponse().get("refresh_token");
        if (!(refreshToken instanceof String) || ((String) refreshToken).isBlank()) {
            LOGGER.warning(() -> "[graphauth-sdk] login for provider " + event.providerId()
                + " returned no refresh_token; is offline_access requested and consented?");
            throw new ConfigException("provider " + event.providerId()
                + " did not return a refresh token; request the offline_access scope");
        }

        List<String> scopes = grantedScopes(event.tokenResponse().get("scope"));
        if (scopes.isEmpty()) {
            scopes = config.getDefaultScopes();
        }
        return new TokenBundle((String) refreshToken, scopes, clock.instant());
    }

    private static List<String> grantedScopes(Object raw) {
        if (raw instanceof String) {
            return Scopes.parse((String) raw);
        }
        if (raw instanceof Collection) {
            List<String> values = new ArrayList<>();
            for (Object item : (Collection<?>) raw) {
                if (item instanceof String) {
                    values.add((String) item);
                }
            }
            return Scopes.normalize(values);
        }
        return List.of();
    }
}
