package cloud.graphauth.sdk.callback;

/**
 * Host-supplied destination for artifacts, usually the outgoing HTTP response.
 */
@FunctionalInterface
public interface ArtifactSink {

    void store(ArtifactCookie cookie);
}
