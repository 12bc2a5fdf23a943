package cloud.graphauth.sdk;

import java.util.List;

/**
 * Exception representing an error returned by the token endpoint. When the provider responds with a non-2xx status
 * the SDK hydrates this type so callers can inspect the HTTP status, the OAuth error code and the
 * Microsoft identity platform {@code error_codes}.
 */
public final class ProviderApiException extends ProviderException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;
    private final List<Integer> errorCodes;

    public ProviderApiException(ProviderErrorKind kind, int statusCode, String code, List<Integer> errorCodes, String message) {
        super(kind, message == null || message.isBlank() ? defaultMessage(statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
        this.errorCodes = errorCodes == null ? List.of() : List.copyOf(errorCodes);
    }

    /**
     * @return HTTP status code returned by the token endpoint.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return OAuth {@code error} value (nullable when the response body did not include one).
     */
    public String getCode() {
        return code;
    }

    /**
     * @return numeric AADSTS codes from {@code error_codes}; empty when absent.
     */
    public List<Integer> getErrorCodes() {
        return errorCodes;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "HTTP " + status;
        }
        return "HTTP " + status + " (" + code + ")";
    }
}
