package com.taxidispatch.dispatch.service;

import java.time.Duration;

public class SleepingTransitPacer implements TransitPacer {

    @Override
    public void pause(Duration duration) throws InterruptedException {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        }
    }
}
