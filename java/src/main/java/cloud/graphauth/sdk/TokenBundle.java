package cloud.graphauth.sdk;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Refresh token custody record carried by the client inside an encrypted artifact.
 *
 * <p>
 * Instances are immutable. When the provider rotates the refresh token a new bundle replaces the old one wholesale;
 * nothing is ever updated in place.
 * </p>
 */
public final class TokenBundle {

    private final String refreshToken;
    private final List<String> scopes;
    private final Instant issuedAt;

    public TokenBundle(String refreshToken, List<String> scopes, Instant issuedAt) {
        Objects.requireNonNull(refreshToken, "refreshToken");
        if (refreshToken.isBlank()) {
            throw new IllegalArgumentException("refreshToken must be non-empty");
        }
        this.refreshToken = refreshToken;
        this.scopes = scopes == null ? List.of() : List.copyOf(scopes);
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    /**
     * @return granted scopes in the order the provider reported them; may be empty.
     */
    public List<String> getScopes() {
        return scopes;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TokenBundle)) {
            return false;
        }
        TokenBundle other = (TokenBundle) o;
        return refreshToken.equals(other.refreshToken)
            && scopes.equals(other.scopes)
            && issuedAt.equals(other.issuedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(refreshToken, scopes, issuedAt);
    }

    @Override
    public String toString() {
        return "TokenBundle{refreshToken=<redacted>, scopes=" + scopes + ", issuedAt=" + issuedAt + "}";
    }
}
