package com.cardroll.pity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Pity counter for one player and one pack type.
 *
 * {@code counter} is the number of consecutive rolls since the last qualifying result and
 * always stays within {@code [0, threshold]}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PityState {

    int counter;
    int threshold;

    public static PityState initial(int threshold) {
        return of(0, threshold);
    }

    public static PityState of(int counter, int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Pity threshold must be at least 1: " + threshold);
        }
        if (counter < 0 || counter > threshold) {
            throw new IllegalArgumentException(
                String.format("Pity counter %d outside [0, %d]", counter, threshold));
        }
        return new PityState(counter, threshold);
    }

    /**
     * True when the next roll has to be upgraded to keep the guarantee.
     */
    public boolean mustForceNext() {
        return counter >= threshold - 1;
    }

    public PityState afterRoll(boolean qualifying) {
        if (qualifying) {
            return new PityState(0, threshold);
        }
        return new PityState(Math.min(counter + 1, threshold), threshold);
    }

    /**
     * Re-anchor a stored state on a (possibly changed) configured threshold.
     */
    public PityState withThreshold(int newThreshold) {
        if (newThreshold == threshold) {
            return this;
        }
        return of(Math.min(counter, newThreshold), newThreshold);
    }
}
