package cloud.graphauth.sdk.callback;

/**
 * Registration point the host exposes for observing every successful authentication.
 */
public interface AuthenticationHooks {

    void register(AuthenticationListener listener);
}
