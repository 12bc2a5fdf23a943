package cloud.graphauth.sdk.crypto;

import cloud.graphauth.sdk.ConfigException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide key-derivation input for {@link TokenCodec}. Rotating it invalidates every artifact issued so far.
 */
public final class SharedSecret {

    public static final String ENV_SECRET = "WEBUI_SECRET_KEY";

    private final byte[] material;

    private SharedSecret(byte[] material) {
        this.material = material;
    }

    public static SharedSecret of(String secret) {
        Objects.requireNonNull(secret, "secret");
        String trimmed = secret.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("shared secret must be non-empty");
        }
        return new SharedSecret(trimmed.getBytes(StandardCharsets.UTF_8));
    }

    public static SharedSecret of(byte[] secret) {
        Objects.requireNonNull(secret, "secret");
        if (secret.length == 0) {
            throw new IllegalArgumentException("shared secret must be non-empty");
        }
        return new SharedSecret(secret.clone());
    }

    /**
     * @throws ConfigException when {@value #ENV_SECRET} is missing or blank.
     */
    public static SharedSecret fromEnvironment(Map<String, String> env) throws ConfigException {
        String value = env.get(ENV_SECRET);
        if (value == null || value.isBlank()) {
            throw new ConfigException("missing required configuration: " + ENV_SECRET);
        }
        return of(value);
    }

    byte[] material() {
        return material.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SharedSecret && Arrays.equals(material, ((SharedSecret) o).material);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(material);
    }

    @Override
    public String toString() {
        return "SharedSecret[redacted]";
    }
}
