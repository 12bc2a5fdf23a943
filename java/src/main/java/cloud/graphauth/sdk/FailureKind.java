package cloud.graphauth.sdk;

/**
 * The four outcomes a caller of {@code TokenSupplier} has to distinguish when no access token is available.
 */
public enum FailureKind {
    /** Prompt the user to sign in again. */
    AUTH_REQUIRED,
    /** Deployment misconfiguration; show an operator diagnostic. */
    CONFIG_ERROR,
    /** Safe to retry later with backoff. */
    PROVIDER_TRANSIENT,
    /** Provider refused the client or the request; never retried. */
    PROVIDER_FATAL
}
