package com.theset.setlist.domain.port.out;

/**
 * The only two capabilities consumed from the authentication provider.
 */
public interface AuthProvider {

    boolean isAuthenticated();

    /**
     * Triggers the provider's login flow
     */
    void login();
}
