package com.nevis.xray.infra;

import java.util.function.Supplier;

public interface RateLimiter {

    void acquire(String key);

    default <T> T execute(String key, Supplier<T> task) {
        acquire(key);
        return task.get();
    }
}
