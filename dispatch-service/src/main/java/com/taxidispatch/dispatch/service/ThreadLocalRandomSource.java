package com.taxidispatch.dispatch.service;

import java.util.concurrent.ThreadLocalRandom;

public class ThreadLocalRandomSource implements RandomSource {

    @Override
    public int nextInt(int min, int max) {
        if (min >= max) {
            return min;
        }
        return ThreadLocalRandom.current().nextInt(min, max + 1);
    }

    @Override
    public double nextDouble(double min, double max) {
        if (min >= max) {
            return min;
        }
        return ThreadLocalRandom.current().nextDouble(min, max);
    }
}
