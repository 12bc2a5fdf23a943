package cloud.graphauth.sdk.auth;

import java.util.List;
import java.util.Objects;

/**
 * Successful token endpoint response.
 *
 * @param accessToken  freshly issued access token
 * @param refreshToken replacement refresh token when the provider rotated it, otherwise {@code null}
 * @param grantedScopes scopes reported in the response's {@code scope} field; empty when absent
 * @param scopeDropped  {@code true} when the grant came from the retry without a {@code scope} parameter
 */
public record TokenGrant(
    AccessToken accessToken,
    String refreshToken,
    List<String> grantedScopes,
    boolean scopeDropped
) {

    public TokenGrant {
        Objects.requireNonNull(accessToken, "accessToken");
        grantedScopes = grantedScopes == null ? List.of() : List.copyOf(grantedScopes);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    @Override
    public String toString() {
        return "TokenGrant{accessToken=" + accessToken
            + ", refreshToken=" + (hasRefreshToken() ? "<redacted>" : "none")
            + ", grantedScopes=" + grantedScopes
            + ", scopeDropped=" + scopeDropped + "}";
    }
}
