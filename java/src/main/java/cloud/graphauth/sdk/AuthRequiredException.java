package cloud.graphauth.sdk;

/**
 * The user must sign in again. Retrying the same call will not help.
 */
public final class AuthRequiredException extends GraphAuthException {

    private static final long serialVersionUID = 1L;

    public AuthRequiredException(String message) {
        super(message);
    }

    public AuthRequiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
