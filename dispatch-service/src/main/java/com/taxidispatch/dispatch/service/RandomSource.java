package com.taxidispatch.dispatch.service;

/**
 * Source of randomness for ratings, starting points and rider movement.
 * Injected so tests can make every draw deterministic.
 */
public interface RandomSource {

    /** Uniform integer in the closed range {@code [min, max]}. */
    int nextInt(int min, int max);

    /** Uniform double in {@code [min, max)}. */
    double nextDouble(double min, double max);
}
