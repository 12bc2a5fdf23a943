package cloud.graphauth.sdk;

/**
 * Fatal deployment misconfiguration: missing provider settings, or an authentication that did not grant a
 * refresh token. Never retried; intended for operators rather than end users.
 */
public final class ConfigException extends GraphAuthException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
