package cloud.graphauth.sdk.internal;

import cloud.graphauth.sdk.ProviderApiException;
import cloud.graphauth.sdk.ProviderErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decodes and classifies OAuth 2.0 error payloads from the Microsoft identity platform token endpoint.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    // AADSTS70011 invalid scope, 65001 consent not granted, 28002/28003 invalid or empty scope value
    private static final Set<Integer> SCOPE_ERROR_CODES = Set.of(70011, 65001, 28002, 28003);

    private static final Set<String> GRANT_ERRORS = Set.of("invalid_grant", "interaction_required");
    private static final Set<String> CLIENT_ERRORS = Set.of("invalid_client", "unauthorized_client");

    private static final int MAX_FALLBACK_MESSAGE = 200;

    private ApiErrorDecoder() {
    }

    public static ProviderApiException decode(int statusCode, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new ProviderApiException(classify(statusCode, null, List.of()), statusCode, null, List.of(), null);
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            JsonNode errorNode = node.path("error");
            String code = errorNode.isTextual() ? errorNode.asText() : null;
            List<Integer> errorCodes = new ArrayList<>();
            node.path("error_codes").forEach(item -> {
                if (item.canConvertToInt()) {
                    errorCodes.add(item.asInt());
                }
            });
            String message = errorText(node);
            return new ProviderApiException(classify(statusCode, code, errorCodes), statusCode, code, errorCodes, message);
        } catch (IOException ex) {
            String fallback = new String(bytes, StandardCharsets.UTF_8);
            if (fallback.length() > MAX_FALLBACK_MESSAGE) {
                fallback = fallback.substring(0, MAX_FALLBACK_MESSAGE);
            }
            return new ProviderApiException(classify(statusCode, null, List.of()), statusCode, null, List.of(), fallback);
        }
    }

    /**
     * Maps a token endpoint rejection onto a {@link ProviderErrorKind}. Scope-specific codes win over the generic
     * {@code invalid_grant}, because consent failures (65001) are reported under that error.
     */
    public static ProviderErrorKind classify(int statusCode, String code, List<Integer> errorCodes) {
        if (statusCode == 408 || statusCode == 429 || statusCode >= 500) {
            return ProviderErrorKind.TRANSIENT;
        }
        String normalized = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        if ("invalid_scope".equals(normalized)) {
            return ProviderErrorKind.SCOPE_REJECTED;
        }
        if (errorCodes != null) {
            for (Integer errorCode : errorCodes) {
                if (SCOPE_ERROR_CODES.contains(errorCode)) {
                    return ProviderErrorKind.SCOPE_REJECTED;
                }
            }
        }
        if (GRANT_ERRORS.contains(normalized)) {
            return ProviderErrorKind.INVALID_GRANT;
        }
        if (CLIENT_ERRORS.contains(normalized)) {
            return ProviderErrorKind.INVALID_CLIENT;
        }
        if ("temporarily_unavailable".equals(normalized)) {
            return ProviderErrorKind.TRANSIENT;
        }
        return ProviderErrorKind.FATAL;
    }

    private static String errorText(JsonNode node) {
        String description = Json.text(node.path("error_description"));
        if (description != null) {
            return description;
        }
        String message = Json.text(node.path("message"));
        if (message != null) {
            return message;
        }
        JsonNode error = node.path("error");
        if (error.isObject()) {
            return Json.text(error.path("message"));
        }
        return null;
    }
}
