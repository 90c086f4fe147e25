package com.alleato.insights.infra;

import java.util.function.Supplier;

/**
 * Throttles calls to the hosted model APIs. {@code permits} is the request's cost
 * in tokens for limiters that meter throughput; request-count limiters ignore it.
 */
public interface RateLimiter {

    void acquire(String key, int permits);

    default <T> T execute(String key, int permits, Supplier<T> task) {
        acquire(key, permits);
        return task.get();
    }
}
