package com.vanityhub.server.service.ratelimit;

/**
 * Admit/reject answer for one request.
 *
 * @param admitted          whether the request may proceed
 * @param limit             maximum requests in the window
 * @param remaining         requests left in the current window, never negative
 * @param resetAt           epoch millis at which the window resets
 * @param retryAfterSeconds seconds until retry is allowed; 0 when admitted
 */
public record RateLimitDecision(boolean admitted, int limit, int remaining, long resetAt, long retryAfterSeconds) {

    public static RateLimitDecision admit(int limit, int remaining, long resetAt) {
        return new RateLimitDecision(true, limit, remaining, resetAt, 0);
    }

    public static RateLimitDecision reject(int limit, long resetAt, long retryAfterSeconds) {
        return new RateLimitDecision(false, limit, 0, resetAt, retryAfterSeconds);
    }
}
