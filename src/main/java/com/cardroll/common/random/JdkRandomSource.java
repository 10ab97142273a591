package com.cardroll.common.random;

import java.security.SecureRandom;
import java.util.Random;

/**
 * {@link RandomSource} backed by a {@link Random}.
 *
 * A seeded instance replays the same sequence of draws for the same sequence of calls.
 */
public class JdkRandomSource implements RandomSource {

    private final Random random;

    public JdkRandomSource(Random random) {
        this.random = random;
    }

    public static JdkRandomSource seeded(long seed) {
        return new JdkRandomSource(new Random(seed));
    }

    public static JdkRandomSource secure() {
        return new JdkRandomSource(new SecureRandom());
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }
}
