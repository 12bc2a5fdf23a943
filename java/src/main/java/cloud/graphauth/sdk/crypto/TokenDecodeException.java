package cloud.graphauth.sdk.crypto;

import cloud.graphauth.sdk.GraphAuthException;

/**
 * The artifact could not be turned back into a bundle: wrong format, wrong key, or tampered bytes.
 */
public final class TokenDecodeException extends GraphAuthException {

    private static final long serialVersionUID = 1L;

    public TokenDecodeException(String message) {
        super(message);
    }

    public TokenDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
