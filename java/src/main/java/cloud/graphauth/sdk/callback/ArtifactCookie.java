package cloud.graphauth.sdk.callback;

import cloud.graphauth.sdk.crypto.EncryptedArtifact;

import java.time.Duration;
import java.util.Objects;

/**
 * Cookie carrying an encrypted artifact. Always {@code HttpOnly}, {@code Secure}, {@code SameSite=Strict} and
 * scoped to {@code Path=/}.
 */
public final class ArtifactCookie {

    public static final String PATH = "/";
    public static final String SAME_SITE = "Strict";

    private final String name;
    private final String value;
    private final Duration maxAge;

    private ArtifactCookie(String name, String value, Duration maxAge) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
        this.maxAge = Objects.requireNonNull(maxAge, "maxAge");
    }

    public static ArtifactCookie of(String name, EncryptedArtifact artifact, Duration maxAge) {
        Objects.requireNonNull(artifact, "artifact");
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive");
        }
        return new ArtifactCookie(name, artifact.toCookieValue(), maxAge);
    }

    /**
     * A cookie that makes the client discard the stored artifact.
     */
    public static ArtifactCookie expired(String name) {
        return new ArtifactCookie(name, "", Duration.ZERO);
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    public boolean isHttpOnly() {
        return true;
    }

    public boolean isSecure() {
        return true;
    }

    public boolean isExpired() {
        return maxAge.isZero();
    }

    /**
     * @return value for a {@code Set-Cookie} response header.
     */
    public String toSetCookieHeader() {
        return name + "=" + value
            + "; Max-Age=" + maxAge.getSeconds()
            + "; Path=" + PATH
            + "; Secure; HttpOnly; SameSite=" + SAME_SITE;
    }

    @Override
    public String toString() {
        return "ArtifactCookie{name=" + name + ", maxAge=" + maxAge + ", expired=" + isExpired() + "}";
    }
}
