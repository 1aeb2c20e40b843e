package com.taxidispatch.dispatch.service;

import java.time.Duration;

/**
 * Pauses the calling thread to simulate the passage of time (transit, gaps between requests).
 */
@FunctionalInterface
public interface TransitPacer {

    void pause(Duration duration) throws InterruptedException;
}
