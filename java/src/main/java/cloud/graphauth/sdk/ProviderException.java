package cloud.graphauth.sdk;

import java.util.Objects;

/**
 * Failure talking to the OAuth provider's token endpoint.
 */
public class ProviderException extends GraphAuthException {

    private static final long serialVersionUID = 1L;

    private final ProviderErrorKind kind;

    public ProviderException(ProviderErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ProviderException(ProviderErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ProviderErrorKind getKind() {
        return kind;
    }
}
