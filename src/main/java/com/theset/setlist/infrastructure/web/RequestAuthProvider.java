package com.theset.setlist.infrastructure.web;

import com.theset.setlist.domain.port.out.AuthProvider;

/**
 * Auth capability of a single HTTP request. The gateway authenticates the caller and
 * forwards the user in a header; login() only records that the caller must sign in.
 */
public class RequestAuthProvider implements AuthProvider {

    private final String authenticatedUser;
    private boolean loginRequested;

    public RequestAuthProvider(String authenticatedUser) {
        this.authenticatedUser = authenticatedUser;
    }

    @Override
    public boolean isAuthenticated() {
        return authenticatedUser != null && !authenticatedUser.isBlank();
    }

    @Override
    public void login() {
        loginRequested = true;
    }

    public boolean loginRequested() {
        return loginRequested;
    }
}
