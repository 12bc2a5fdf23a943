package cloud.graphauth.sdk;

/**
 * Root of the checked failures raised while minting access tokens from client-held artifacts.
 *
 * <p>
 * Subclasses line up with {@link FailureKind}: {@link AuthRequiredException} means the user must sign in again,
 * {@link ConfigException} points at deployment settings, and {@link ProviderException} carries the token endpoint's
 * classification. Messages never contain token material.
 * </p>
 *
 * @see TokenResult#orElseThrow()
 */
public class GraphAuthException extends Exception {

    private static final long serialVersionUID = 1L;

    public GraphAuthException(String message) {
        super(message);
    }

    public GraphAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
