package com.cardroll.common.random;

/**
 * Source of randomness injected into the roll engine.
 *
 * Implementations must be safe for use from multiple threads.
 */
public interface RandomSource {

    /**
     * @return a uniformly distributed value in {@code [0, 1)}
     */
    double nextDouble();

    /**
     * @param bound exclusive upper bound, must be positive
     * @return a uniformly distributed value in {@code [0, bound)}
     */
    int nextInt(int bound);
}
