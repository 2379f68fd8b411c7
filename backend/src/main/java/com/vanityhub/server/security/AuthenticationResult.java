package com.vanityhub.server.security;

import com.vanityhub.server.model.Principal;

/**
 * Outcome of resolving a request's credentials: a principal, or the reason there is none.
 */
public record AuthenticationResult(Principal principal, Failure failure) {

    public enum Failure {
        /** No bearer token on the request. */
        MISSING,
        /** Token present but rejected by the verifier or carrying unusable claims. */
        INVALID,
        /** Verifier did not answer in time, or failed. */
        TIMEOUT
    }

    public static AuthenticationResult success(Principal principal) {
        return new AuthenticationResult(principal, null);
    }

    public static AuthenticationResult failure(Failure failure) {
        return new AuthenticationResult(null, failure);
    }

    public boolean isAuthenticated() {
        return principal != null;
    }
}
