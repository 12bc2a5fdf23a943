package cloud.graphauth.sdk.auth;

import cloud.graphauth.sdk.FailureKind;
import cloud.graphauth.sdk.ProviderApiException;
import cloud.graphauth.sdk.ProviderConfig;
import cloud.graphauth.sdk.ProviderException;
import cloud.graphauth.sdk.TokenBundle;
import cloud.graphauth.sdk.TokenResult;
import cloud.graphauth.sdk.callback.ArtifactCookie;
import cloud.graphauth.sdk.callback.ArtifactSink;
import cloud.graphauth.sdk.crypto.EncryptedArtifact;
import cloud.graphauth.sdk.crypto.TokenCodec;
import cloud.graphauth.sdk.crypto.TokenDecodeException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-call entry point for tool logic: turns the caller's stored artifact into a fresh {@link AccessToken}.
 *
 * <p>
 * Every call decodes the artifact and redeems the refresh token again; access tokens are never cached, and the
 * supplier keeps no per-user state, so any number of instances can serve the same user concurrently. Expected
 * failures are returned as a {@link TokenResult} carrying exactly one {@link FailureKind}; nothing is thrown.
 * </p>
 */
public final class TokenSupplier {

    private static final Logger LOGGER = Logger.getLogger(TokenSupplier.class.getName());

    static final Duration CLOCK_SKEW = Duration.ofMinutes(5);
    private static final int CONSENT_REQUIRED = 65001;

    private final ProviderConfig config;
    private final TokenCodec codec;
    private final ProviderClient providerClient;
    private final Clock clock;

    public TokenSupplier(ProviderConfig config, TokenCodec codec, ProviderClient providerClient) {
        this(config, codec, providerClient, Clock.systemUTC());
    }

    public TokenSupplier(ProviderConfig config, TokenCodec codec, ProviderClient providerClient, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.providerClient = Objects.requireNonNull(providerClient, "providerClient");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Obtains an access token from the stored artifact's cookie value.
     *
     * @param storedArtifact cookie value, or {@code null} when the client sent none
     */
    public TokenResult getAccessToken(String storedArtifact) {
        if (storedArtifact == null || storedArtifact.isBlank()) {
            return authRequired("no stored artifact", null);
        }

        TokenBundle bundle;
        try {
            bundle = codec.decode(storedArtifact);
        } catch (TokenDecodeException ex) {
            return authRequired("stored artifact could not be decoded", ex);
        }

        Instant now = clock.instant();
        // compare ages rather than shifting instants so extreme iat or max-age values cannot overflow
        if (Duration.between(bundle.getIssuedAt(), now).compareTo(config.getArtifactMaxAge()) > 0) {
            return authRequired("stored artifact older than " + config.getArtifactMaxAge(), null);
        }
        if (bundle.getIssuedAt().isAfter(now.plus(CLOCK_SKEW))) {
            return authRequired("stored artifact issued in the future", null);
        }

        List<String> scopes = bundle.getScopes().isEmpty() ? config.getDefaultScopes() : bundle.getScopes();
        TokenGrant grant;
        try {
            grant = providerClient.redeem(bundle.getRefreshToken(), scopes);
        } catch (ProviderException ex) {
            return mapFailure(ex);
        }

        TokenBundle rotated = null;
        if (grant.hasRefreshToken() && !grant.refreshToken().equals(bundle.getRefreshToken())) {
            List<String> rotatedScopes = grant.grantedScopes().isEmpty() ? bundle.getScopes() : grant.grantedScopes();
            rotated = new TokenBundle(grant.refreshToken(), rotatedScopes, now);
        }

        boolean rotatedToken = rotated != null;
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[graphauth-sdk] access token issued, expires %s, scopeDropped=%s, rotated=%s",
            grant.accessToken().getExpiresAt(), grant.scopeDropped(), rotatedToken));
        return TokenResult.success(grant.accessToken(), rotated);
    }

    /**
     * Like {@link #getAccessToken(String)}, and when the provider rotated the refresh token the replacement
     * artifact is written to {@code sink}.
     */
    public TokenResult getAccessToken(String storedArtifact, ArtifactSink sink) {
        Objects.requireNonNull(sink, "sink");
        TokenResult result = getAccessToken(storedArtifact);
        result.getRotatedBundle().ifPresent(bundle -> {
            EncryptedArtifact replacement = codec.encode(bundle);
            sink.store(ArtifactCookie.of(config.getCookieName(), replacement, config.getArtifactMaxAge()));
        });
        return result;
    }

    private TokenResult mapFailure(ProviderException ex) {
        switch (ex.getKind()) {
            case INVALID_GRANT:
                return authRequired("refresh token rejected: " + ex.getMessage(), ex);
            case SCOPE_REJECTED:
                if (ex instanceof ProviderApiException
                    && ((ProviderApiException) ex).getErrorCodes().contains(CONSENT_REQUIRED)) {
                    return authRequired("consent required: " + ex.getMessage(), ex);
                }
                return operatorFailure(FailureKind.PROVIDER_FATAL, "scopes rejected even without scope parameter: " + ex.getMessage(), ex);
            case INVALID_CLIENT:
                return operatorFailure(FailureKind.CONFIG_ERROR, "client credentials rejected: " + ex.getMessage(), ex);
            case TRANSIENT:
                LOGGER.info(() -> "[graphauth-sdk] transient token endpoint failure: " + ex.getMessage());
                return TokenResult.failure(FailureKind.PROVIDER_TRANSIENT, ex.getMessage(), ex);
            default:
                return operatorFailure(FailureKind.PROVIDER_FATAL, ex.getMessage(), ex);
        }
    }

    private static TokenResult authRequired(String diagnostic, Throwable cause) {
        LOGGER.fine(() -> "[graphauth-sdk] re-authentication required: " + diagnostic);
        return TokenResult.failure(FailureKind.AUTH_REQUIRED, diagnostic, cause);
    }

    private static TokenResult operatorFailure(FailureKind kind, String diagnostic, Throwable cause) {
        LOGGER.log(Level.WARNING, String.format(Locale.ROOT, "[graphauth-sdk] %s: %s", kind, diagnostic));
        return TokenResult.failure(kind, diagnostic, cause);
    }
}
