package cloud.graphauth.sdk.callback;

import cloud.graphauth.sdk.GraphAuthException;

@FunctionalInterface
public interface AuthenticationListener {

    void onAuthenticated(AuthenticationEvent event) throws GraphAuthException;
}
