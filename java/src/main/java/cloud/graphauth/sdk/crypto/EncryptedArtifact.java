package cloud.graphauth.sdk.crypto;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Opaque ciphertext produced by {@link TokenCodec}, stored by the caller (typically as a cookie value).
 */
public final class EncryptedArtifact {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final byte[] bytes;

    private EncryptedArtifact(byte[] bytes) {
        this.bytes = bytes;
    }

    public static EncryptedArtifact fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new EncryptedArtifact(bytes.clone());
    }

    /**
     * Parses the cookie-safe text form. Only the canonical unpadded base64url encoding is accepted, so two different
     * strings never map to the same bytes.
     *
     * @throws TokenDecodeException when the value is not canonical base64url.
     */
    public static EncryptedArtifact fromCookieValue(String value) throws TokenDecodeException {
        if (value == null || value.isEmpty()) {
            throw new TokenDecodeException("artifact is empty");
        }
        byte[] decoded;
        try {
            decoded = DECODER.decode(value);
        } catch (IllegalArgumentException ex) {
            throw new TokenDecodeException("artifact is not base64url", ex);
        }
        if (!ENCODER.encodeToString(decoded).equals(value)) {
            throw new TokenDecodeException("artifact is not canonically encoded");
        }
        return new EncryptedArtifact(decoded);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    public String toCookieValue() {
        return ENCODER.encodeToString(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof EncryptedArtifact && Arrays.equals(bytes, ((EncryptedArtifact) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "EncryptedArtifact[" + bytes.length + " bytes]";
    }
}
