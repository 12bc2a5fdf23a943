package cloud.graphauth.sdk.callback;

import cloud.graphauth.sdk.GraphAuthException;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe {@link AuthenticationHooks} for hosts without their own listener plumbing. The host calls
 * {@link #fire(AuthenticationEvent)} from its login callback after the provider exchange succeeded.
 */
public final class AuthenticationHookRegistry implements AuthenticationHooks {

    private final List<AuthenticationListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void register(AuthenticationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Notifies listeners in registration order; the first failure aborts the remaining notifications.
     */
    public void fire(AuthenticationEvent event) throws GraphAuthException {
        Objects.requireNonNull(event, "event");
        for (AuthenticationListener listener : listeners) {
            listener.onAuthenticated(event);
        }
    }

    public int size() {
        return listeners.size();
    }
}
