package cloud.graphauth.sdk;

import cloud.graphauth.sdk.auth.AccessToken;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single access token lookup: either an {@link AccessToken} or exactly one {@link FailureKind}.
 */
public final class TokenResult {

    static final String SIGN_IN_PROMPT = "Sign in with Microsoft again to continue.";
    static final String UNAVAILABLE_PROMPT = "Microsoft 365 is temporarily unavailable. Please try again shortly.";
    static final String MISCONFIGURED_PROMPT = "Microsoft 365 access is not configured correctly. Contact your administrator.";

    private final AccessToken accessToken;
    private final TokenBundle rotatedBundle;
    private final FailureKind failure;
    private final String diagnostic;
    private final Throwable cause;

    private TokenResult(AccessToken accessToken, TokenBundle rotatedBundle, FailureKind failure, String diagnostic, Throwable cause) {
        this.accessToken = accessToken;
        this.rotatedBundle = rotatedBundle;
        this.failure = failure;
        this.diagnostic = diagnostic;
        this.cause = cause;
    }

    public static TokenResult success(AccessToken accessToken, TokenBundle rotatedBundle) {
        return new TokenResult(Objects.requireNonNull(accessToken, "accessToken"), rotatedBundle, null, null, null);
    }

    public static TokenResult failure(FailureKind failure, String diagnostic, Throwable cause) {
        return new TokenResult(null, null, Objects.requireNonNull(failure, "failure"), diagnostic, cause);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<AccessToken> getAccessToken() {
        return Optional.ofNullable(accessToken);
    }

    /**
     * Present when the provider rotated the refresh token. The caller must re-encode and persist it; the previous
     * artifact is superseded.
     */
    public Optional<TokenBundle> getRotatedBundle() {
        return Optional.ofNullable(rotatedBundle);
    }

    public Optional<FailureKind> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Operator-facing detail. Do not show it to end users.
     */
    public String getDiagnostic() {
        return diagnostic;
    }

    public Throwable getCause() {
        return cause;
    }

    /**
     * Text suitable for an end user; empty on success.
     */
    public String userMessage() {
        if (failure == null) {
            return "";
        }
        switch (failure) {
            case AUTH_REQUIRED:
                return SIGN_IN_PROMPT;
            case PROVIDER_TRANSIENT:
                return UNAVAILABLE_PROMPT;
            default:
                return MISCONFIGURED_PROMPT;
        }
    }

    /**
     * Returns the access token or throws the exception matching the failure kind.
     */
    public AccessToken orElseThrow() throws GraphAuthException {
        if (failure == null) {
            return accessToken;
        }
        switch (failure) {
            case AUTH_REQUIRED:
                throw new AuthRequiredException(diagnostic, cause);
            case CONFIG_ERROR:
                throw new ConfigException(diagnostic, cause);
            case PROVIDER_TRANSIENT:
                throw new ProviderException(ProviderErrorKind.TRANSIENT, diagnostic, cause);
            default:
                throw new ProviderException(ProviderErrorKind.FATAL, diagnostic, cause);
        }
    }

    @Override
    public String toString() {
        if (failure == null) {
            return "TokenResult{success, accessToken=" + accessToken + ", rotated=" + (rotatedBundle != null) + "}";
        }
        return "TokenResult{failure=" + failure + ", diagnostic=" + diagnostic + "}";
    }
}
