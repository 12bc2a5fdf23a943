package cloud.graphauth.sdk;

/**
 * Classification of a failed token endpoint exchange.
 */
public enum ProviderErrorKind {
    /** Rejected because of the requested scopes; eligible for one retry without a scope parameter. */
    SCOPE_REJECTED,
    /** Refresh token invalid, expired or revoked, or user interaction is required. */
    INVALID_GRANT,
    /** Client credentials or application registration are wrong. */
    INVALID_CLIENT,
    /** Network failure, timeout, throttling or 5xx. */
    TRANSIENT,
    /** Malformed request or response, or any other non-retryable rejection. */
    FATAL
}
