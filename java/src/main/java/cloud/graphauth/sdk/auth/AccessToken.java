package cloud.graphauth.sdk.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Short-lived bearer credential for the downstream API. Valid for a single operation; never cache it.
 */
public final class AccessToken {

    private final String value;
    private final Instant expiresAt;

    public AccessToken(String value, Instant expiresAt) {
        this.value = Objects.requireNonNull(value, "value");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public String getValue() {
        return value;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * @return value for an {@code Authorization} header.
     */
    public String asBearerHeader() {
        return "Bearer " + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccessToken)) {
            return false;
        }
        AccessToken other = (AccessToken) o;
        return value.equals(other.value) && expiresAt.equals(other.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, expiresAt);
    }

    @Override
    public String toString() {
        return "AccessToken{value=<redacted>, expiresAt=" + expiresAt + "}";
    }
}
