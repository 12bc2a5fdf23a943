package cloud.graphauth.sdk.crypto;

import cloud.graphauth.sdk.TokenBundle;
import cloud.graphauth.sdk.internal.Json;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Authenticated encryption of {@link TokenBundle} values into client-held artifacts.
 *
 * <p>
 * Layout: {@code version(1) || nonce(12) || AES-256-GCM ciphertext with 128-bit tag}. The version byte is bound
 * as associated data, so flipping any bit anywhere makes {@link #decode} fail. The AES key is derived from the
 * {@link SharedSecret} with HKDF-SHA256; instances are immutable and thread-safe.
 * </p>
 */
public final class TokenCodec {

    static final byte FORMAT_VERSION = 1;
    static final int NONCE_LENGTH = 12;
    private static final int TAG_BITS = 128;
    private static final int MIN_LENGTH = 1 + NONCE_LENGTH + TAG_BITS / 8;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final String KDF_SALT = "graphauth-sdk/token-bundle";
    private static final String KDF_INFO = "aes-256-gcm/v1";

    private final SecretKey key;
    private final SecureRandom random;

    public TokenCodec(SharedSecret secret) {
        this(secret, new SecureRandom());
    }

    TokenCodec(SharedSecret secret, SecureRandom random) {
        Objects.requireNonNull(secret, "secret");
        byte[] material = secret.material();
        byte[] derived = KeyDerivation.hkdfSha256(material, KDF_SALT, KDF_INFO, 32);
        Arrays.fill(material, (byte) 0);
        this.key = new SecretKeySpec(derived, "AES");
        Arrays.fill(derived, (byte) 0);
        this.random = Objects.requireNonNull(random, "random");
    }

    public EncryptedArtifact encode(TokenBundle bundle) {
        Objects.requireNonNull(bundle, "bundle");
        byte[] plaintext;
        try {
            plaintext = Json.mapper().writeValueAsBytes(
                new BundlePayload(bundle.getRefreshToken(), bundle.getScopes(), bundle.getIssuedAt()));
        } catch (IOException ex) {
            throw new IllegalStateException("serialize token bundle", ex);
        }
        return seal(plaintext);
    }

    /**
     * Encrypts an already serialised payload and wipes {@code plaintext} afterwards.
     */
    EncryptedArtifact seal(byte[] plaintext) {
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            cipher.updateAAD(new byte[] {FORMAT_VERSION});
            byte[] sealed = cipher.doFinal(plaintext);

            ByteBuffer out = ByteBuffer.allocate(1 + NONCE_LENGTH + sealed.length);
            out.put(FORMAT_VERSION).put(nonce).put(sealed);
            return EncryptedArtifact.fromBytes(out.array());
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("encrypt token bundle", ex);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    public TokenBundle decode(EncryptedArtifact artifact) throws TokenDecodeException {
        Objects.requireNonNull(artifact, "artifact");
        byte[] bytes = artifact.toBytes();
        if (bytes.length < MIN_LENGTH) {
            throw new TokenDecodeException("artifact too short");
        }
        if (bytes[0] != FORMAT_VERSION) {
            throw new TokenDecodeException("unsupported artifact version " + (bytes[0] & 0xff));
        }

        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, bytes, 1, NONCE_LENGTH));
            cipher.updateAAD(bytes, 0, 1);
            plaintext = cipher.doFinal(bytes, 1 + NONCE_LENGTH, bytes.length - 1 - NONCE_LENGTH);
        } catch (AEADBadTagException ex) {
            throw new TokenDecodeException("artifact failed authentication", ex);
        } catch (GeneralSecurityException ex) {
            throw new TokenDecodeException("decrypt artifact: " + ex.getMessage(), ex);
        }

        try {
            BundlePayload payload = Json.mapper().readValue(plaintext, BundlePayload.class);
            if (payload == null || payload.refreshToken() == null || payload.issuedAt() == null) {
                throw new TokenDecodeException("artifact payload incomplete");
            }
            if (payload.scopes() != null && payload.scopes().contains(null)) {
                throw new TokenDecodeException("artifact payload contains a null scope");
            }
            return new TokenBundle(payload.refreshToken(), payload.scopes(), payload.issuedAt());
        } catch (IOException | IllegalArgumentException ex) {
            throw new TokenDecodeException("decode artifact payload", ex);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    /**
     * Convenience for the cookie text form.
     */
    public TokenBundle decode(String cookieValue) throws TokenDecodeException {
        return decode(EncryptedArtifact.fromCookieValue(cookieValue));
    }

    record BundlePayload(
        @JsonProperty("rt") String refreshToken,
        @JsonProperty("scp") List<String> scopes,
        @JsonProperty("iat") Instant issuedAt
    ) {
    }
}
