package com.example.apitest.util;

/**
 * Blocking pause used by every retry and rate-limit wait, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = seconds -> {
        long millis = Math.round(seconds * 1000);
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(double seconds) throws InterruptedException;
}
