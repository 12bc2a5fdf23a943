package cloud.graphauth.sdk.auth;

import cloud.graphauth.sdk.ProviderApiException;
import cloud.graphauth.sdk.ProviderConfig;
import cloud.graphauth.sdk.ProviderErrorKind;
import cloud.graphauth.sdk.ProviderException;
import cloud.graphauth.sdk.internal.ApiErrorDecoder;
import cloud.graphauth.sdk.internal.Json;
import cloud.graphauth.sdk.internal.Scopes;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Redeems refresh tokens at the provider's token endpoint.
 *
 * <p>
 * Stateless and thread-safe: nothing is cached between calls. When the provider rejects a request because of the
 * requested scopes, the exchange is retried exactly once without a {@code scope} parameter so the provider can fall
 * back to the previously consented set. No other failure is retried here.
 * </p>
 */
public final class ProviderClient {

    private static final Logger LOGGER = Logger.getLogger(ProviderClient.class.getName());

    static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;
    // access tokens never outlive a day; larger values are clamped
    static final long MAX_EXPIRES_IN_SECONDS = 86_400;

    private final ProviderConfig config;
    private final HttpClient httpClient;
    private final Clock clock;

    public ProviderClient(ProviderConfig config) {
        this(config, Clock.systemUTC());
    }

    public ProviderClient(ProviderConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = Objects.requireNonNull(config.getHttpClient(), "httpClient");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Exchanges {@code refreshToken} for an access token.
     *
     * @param refreshToken refresh token from the caller's bundle
     * @param scopes       scopes to request; when empty the {@code scope} parameter is omitted
     * @throws ProviderException classified by {@link ProviderException#getKind()}
     */
    public TokenGrant redeem(String refreshToken, List<String> scopes) throws ProviderException {
        Objects.requireNonNull(refreshToken, "refreshToken");
        List<String> requested = Scopes.normalize(scopes);
        try {
            return exchange(refreshToken, requested, false);
        } catch (ProviderException ex) {
            if (ex.getKind() != ProviderErrorKind.SCOPE_REJECTED || requested.isEmpty()) {
                throw ex;
            }
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[graphauth-sdk] token endpoint rejected %d requested scope(s); retrying without scope",
                requested.size()));
            return exchange(refreshToken, List.of(), true);
        }
    }

    private TokenGrant exchange(String refreshToken, List<String> scopes, boolean scopeDropped) throws ProviderException {
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(tokenRequest(refreshToken, scopes), HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException ex) {
            throw new ProviderException(ProviderErrorKind.TRANSIENT, "token request timed out after " + config.getHttpTimeout(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderErrorKind.TRANSIENT, "token request interrupted", ex);
        } catch (IOException ex) {
            throw new ProviderException(ProviderErrorKind.TRANSIENT, "token request: " + ex.getMessage(), ex);
        }

        byte[] body;
        try (InputStream bodyStream = response.body()) {
            body = bodyStream.readAllBytes();
        } catch (IOException ex) {
            throw new ProviderException(ProviderErrorKind.TRANSIENT, "read token response: " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            ProviderApiException apiError = ApiErrorDecoder.decode(status, body);
            LOGGER.fine(() -> String.format(Locale.ROOT,
                "[graphauth-sdk] token endpoint returned %d error=%s codes=%s kind=%s",
                status, apiError.getCode(), apiError.getErrorCodes(), apiError.getKind()));
            throw apiError;
        }

        JsonNode node;
        try {
            node = Json.mapper().readTree(body);
        } catch (IOException ex) {
            throw new ProviderException(ProviderErrorKind.FATAL, "decode token response: " + ex.getMessage(), ex);
        }
        String accessToken = node == null ? null : Json.text(node.path("access_token"));
        if (accessToken == null) {
            throw new ProviderException(ProviderErrorKind.FATAL, "token response missing access_token");
        }

        Instant expiresAt = clock.instant().plusSeconds(expiresIn(node.path("expires_in")));

        String rotated = Json.text(node.path("refresh_token"));
        List<String> granted = Scopes.parse(node.path("scope").asText(""));

        return new TokenGrant(
            new AccessToken(accessToken, expiresAt),
            rotated,
            granted,
            scopeDropped
        );
    }

    private HttpRequest tokenRequest(String refreshToken, List<String> scopes) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("client_id", config.getClientId());
        form.put("client_secret", config.getClientSecret());
        form.put("refresh_token", refreshToken);
        if (!scopes.isEmpty()) {
            form.put("scope", Scopes.join(scopes));
        }

        return HttpRequest.newBuilder()
            .uri(URI.create(config.getTokenEndpoint()))
            .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .header("User-Agent", config.getUserAgent())
            .timeout(config.getHttpTimeout())
            .build();
    }

    private static String formEncode(Map<String, String> form) {
        StringBuilder body = new StringBuilder();
        form.forEach((key, value) -> {
            if (body.length() > 0) {
                body.append('&');
            }
            body.append(URLEncoder.encode(key, StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(value, StandardCharsets.UTF_8));
        });
        return body.toString();
    }

    private static long expiresIn(JsonNode value) {
        long seconds;
        if (value.isNumber()) {
            seconds = value.asLong();
        } else if (value.isTextual()) {
            // some proxies stringify numeric fields
            seconds = value.asLong(DEFAULT_EXPIRES_IN_SECONDS);
        } else {
            seconds = DEFAULT_EXPIRES_IN_SECONDS;
        }
        if (seconds <= 0) {
            return DEFAULT_EXPIRES_IN_SECONDS;
        }
        return Math.min(seconds, MAX_EXPIRES_IN_SECONDS);
    }
}
