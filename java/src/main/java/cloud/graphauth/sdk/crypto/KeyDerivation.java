package cloud.graphauth.sdk.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;

/**
 * HKDF-SHA256 (RFC 5869) extract-and-expand.
 */
final class KeyDerivation {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int HASH_LENGTH = 32;

    private KeyDerivation() {
    }

    static byte[] hkdfSha256(byte[] inputKeyMaterial, String salt, String info, int length) {
        if (length <= 0 || length > 255 * HASH_LENGTH) {
            throw new IllegalArgumentException("invalid output length " + length);
        }
        try {
            byte[] pseudoRandomKey = hmac(salt.getBytes(StandardCharsets.UTF_8), inputKeyMaterial);
            byte[] infoBytes = info.getBytes(StandardCharsets.UTF_8);

            byte[] output = new byte[length];
            byte[] block = new byte[0];
            int offset = 0;
            for (int counter = 1; offset < length; counter++) {
                Mac mac = Mac.getInstance(HMAC_ALGORITHM);
                mac.init(new SecretKeySpec(pseudoRandomKey, HMAC_ALGORITHM));
                mac.update(block);
                mac.update(infoBytes);
                mac.update((byte) counter);
                block = mac.doFinal();
                int chunk = Math.min(block.length, length - offset);
                System.arraycopy(block, 0, output, offset, chunk);
                offset += chunk;
            }
            Arrays.fill(pseudoRandomKey, (byte) 0);
            return output;
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HmacSHA256 unavailable", ex);
        }
    }

    private static byte[] hmac(byte[] key, byte[] data) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        // HMAC keys may not be empty
        mac.init(new SecretKeySpec(key.length == 0 ? new byte[HASH_LENGTH] : key, HMAC_ALGORITHM));
        return mac.doFinal(data);
    }
}
