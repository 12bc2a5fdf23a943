package cloud.graphauth.sdk;

import cloud.graphauth.sdk.internal.Scopes;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable provider configuration shared by every component. Read once at startup; safe to share across threads.
 */
public final class ProviderConfig {

    public static final String ENV_TENANT_ID = "MICROSOFT_CLIENT_TENANT_ID";
    public static final String ENV_CLIENT_ID = "MICROSOFT_CLIENT_ID";
    public static final String ENV_CLIENT_SECRET = "MICROSOFT_CLIENT_SECRET";
    public static final String ENV_SCOPES = "MICROSOFT_OAUTH_SCOPE";

    public static final String DEFAULT_AUTHORITY = "https://login.microsoftonline.com";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(5);
    public static final String DEFAULT_PROVIDER_ID = "microsoft";
    public static final String DEFAULT_COOKIE_NAME = "ms_graph";
    public static final Duration DEFAULT_ARTIFACT_MAX_AGE = Duration.ofDays(90);
    public static final String DEFAULT_USER_AGENT = "GraphAuth-SDK/0.1.0";

    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "[::1]", "::1");

    private final String tenantId;
    private final String clientId;
    private final String clientSecret;
    private final List<String> defaultScopes;
    private final String tokenEndpoint;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final String providerId;
    private final String cookieName;
    private final Duration artifactMaxAge;
    private final String userAgent;

    private ProviderConfig(Builder builder) {
        this.tenantId = builder.tenantId;
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.defaultScopes = builder.defaultScopes == null ? null : List.copyOf(builder.defaultScopes);
        this.tokenEndpoint = builder.tokenEndpoint;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.providerId = builder.providerId;
        this.cookieName = builder.cookieName;
        this.artifactMaxAge = builder.artifactMaxAge;
        this.userAgent = builder.userAgent;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the configuration from environment-style variables.
     *
     * @throws ConfigException when a required variable is missing or a value is invalid.
     */
    public static ProviderConfig fromEnvironment(Map<String, String> env) throws ConfigException {
        String tenant = trimToNull(env.get(ENV_TENANT_ID));
        String clientId = trimToNull(env.get(ENV_CLIENT_ID));
        String clientSecret = trimToNull(env.get(ENV_CLIENT_SECRET));
        String scopes = trimToNull(env.get(ENV_SCOPES));

        StringBuilder missing = new StringBuilder();
        appendIfMissing(missing, ENV_TENANT_ID, tenant);
        appendIfMissing(missing, ENV_CLIENT_ID, clientId);
        appendIfMissing(missing, ENV_CLIENT_SECRET, clientSecret);
        appendIfMissing(missing, ENV_SCOPES, scopes);
        if (missing.length() > 0) {
            throw new ConfigException("missing required configuration: " + missing);
        }

        try {
            return builder()
                .tenantId(tenant)
                .clientId(clientId)
                .clientSecret(clientSecret)
                .defaultScopes(Scopes.parse(scopes))
                .build();
        } catch (IllegalArgumentException ex) {
            throw new ConfigException("invalid configuration: " + ex.getMessage(), ex);
        }
    }

    public ProviderConfig withDefaults() {
        String resolvedTenant = trimToNull(tenantId);
        if (resolvedTenant == null) {
            throw new IllegalArgumentException("TenantID is required");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("ClientID is required");
        }
        if (clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalArgumentException("ClientSecret is required");
        }
        List<String> resolvedScopes = Scopes.normalize(defaultScopes);
        if (resolvedScopes.isEmpty()) {
            throw new IllegalArgumentException("DefaultScopes must contain at least one scope");
        }

        String resolvedEndpoint = sanitizeUrl(Optional.ofNullable(trimToNull(tokenEndpoint))
            .orElse(DEFAULT_AUTHORITY + "/" + resolvedTenant + "/oauth2/v2.0/token"));

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        Duration resolvedMaxAge = Optional.ofNullable(artifactMaxAge).orElse(DEFAULT_ARTIFACT_MAX_AGE);
        if (resolvedMaxAge.isNegative() || resolvedMaxAge.isZero()) {
            throw new IllegalArgumentException("ArtifactMaxAge must be positive");
        }

        String resolvedCookie = Optional.ofNullable(trimToNull(cookieName)).orElse(DEFAULT_COOKIE_NAME);
        if (!resolvedCookie.matches("[A-Za-z0-9_\\-]+")) {
            throw new IllegalArgumentException("CookieName contains illegal characters: " + resolvedCookie);
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .tenantId(resolvedTenant)
            .clientId(clientId.trim())
            .clientSecret(clientSecret)
            .defaultScopes(resolvedScopes)
            .tokenEndpoint(resolvedEndpoint)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .providerId(Optional.ofNullable(trimToNull(providerId)).orElse(DEFAULT_PROVIDER_ID))
            .cookieName(resolvedCookie)
            .artifactMaxAge(resolvedMaxAge)
            .userAgent(Optional.ofNullable(trimToNull(userAgent)).orElse(DEFAULT_USER_AGENT))
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
            // client secrets and refresh tokens travel in the body; plain http only for a local stub
            boolean loopback = LOOPBACK_HOSTS.contains(uri.getHost().toLowerCase(Locale.ROOT));
            if (!"https".equalsIgnoreCase(uri.getScheme()) && !("http".equalsIgnoreCase(uri.getScheme()) && loopback)) {
                throw new IllegalArgumentException("Token endpoint must use https: " + trimmed);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        return trimmed;
    }

    private static void appendIfMissing(StringBuilder missing, String name, String value) {
        if (value == null) {
            if (missing.length() > 0) {
                missing.append(", ");
            }
            missing.append(name);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public List<String> getDefaultScopes() {
        return defaultScopes;
    }

    public String getTokenEndpoint() {
        return tokenEndpoint;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getCookieName() {
        return cookieName;
    }

    public Duration getArtifactMaxAge() {
        return artifactMaxAge;
    }

    public String getUserAgent() {
        return userAgent;
    }

    @Override
    public String toString() {
        return "ProviderConfig{tenantId=" + tenantId
            + ", clientId=" + clientId
            + ", clientSecret=<redacted>"
            + ", defaultScopes=" + defaultScopes
            + ", tokenEndpoint=" + tokenEndpoint
            + ", httpTimeout=" + httpTimeout
            + ", providerId=" + providerId
            + ", cookieName=" + cookieName
            + ", artifactMaxAge=" + artifactMaxAge + "}";
    }

    public static final class Builder {
        private String tenantId;
        private String clientId;
        private String clientSecret;
        private List<String> defaultScopes;
        private String tokenEndpoint;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private String providerId;
        private String cookieName;
        private Duration artifactMaxAge;
        private String userAgent;

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder defaultScopes(List<String> defaultScopes) {
            this.defaultScopes = defaultScopes;
            return this;
        }

        /**
         * Overrides the token endpoint; defaults to the tenant's v2.0 endpoint on {@link #DEFAULT_AUTHORITY}.
         */
        public Builder tokenEndpoint(String tokenEndpoint) {
            this.tokenEndpoint = tokenEndpoint;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder cookieName(String cookieName) {
            this.cookieName = cookieName;
            return this;
        }

        public Builder artifactMaxAge(Duration artifactMaxAge) {
            this.artifactMaxAge = artifactMaxAge;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public ProviderConfig build() {
            return new ProviderConfig(this).withDefaults();
        }

        private ProviderConfig buildInternal() {
            return new ProviderConfig(this);
        }
    }
}
