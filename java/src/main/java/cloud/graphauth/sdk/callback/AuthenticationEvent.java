package cloud.graphauth.sdk.callback;

import java.util.Map;
import java.util.Objects;

/**
 * A successful sign-in reported by the host.
 *
 * @param providerId    host identifier of the OAuth provider that completed the login
 * @param tokenResponse raw token endpoint response as decoded JSON
 * @param sink          where artifacts for this login's response go
 */
public record AuthenticationEvent(
    String providerId,
    Map<String, Object> tokenResponse,
    ArtifactSink sink
) {

    public AuthenticationEvent {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(sink, "sink");
        tokenResponse = tokenResponse == null ? Map.of() : tokenResponse;
    }

    @Override
    public String toString() {
        return "AuthenticationEvent{providerId=" + providerId + ", fields=" + tokenResponse.keySet() + "}";
    }
}
