package org.sn.realtime.util.concurrent;

import java.util.concurrent.ThreadLocalRandom;


public class Backoff {
    private Backoff() {
    }

    /**
     * Calculate the exponential backoff delay.
     *
     * @param base the time in any unit for the first retry
     * @param retryNumber one for the first call to this function
     * @param capRetries if retryNumber is more than capRetries then set retryNumber to capRetries, to prevent exponential backoff from becoming too big
     * @return the exponential backoff in the same unit as base
     * @throws IllegalArgumentException if retryNumber or capRetries is less than one
     */
    public static long computeExponentialBackoff(long base, int retryNumber, int capRetries) {
        if (retryNumber < 1 || capRetries < 1) {
            throw new IllegalArgumentException("retryNumber and capRetries must be at least one: retryNumber=" + retryNumber + ", capRetries=" + capRetries);
        }
        int count = Math.min(retryNumber, capRetries) - 1;
        return base * (1L << count);
    }

    /**
     * Calculate the exponential backoff delay.
     *
     * @param base the time in any unit for the first retry
     * @param retryNumber one for the first call to this function
     * @param capRetries if retryNumber is more than capRetries then set retryNumber to capRetries
     * @param jitterFraction add a small positive/negative random value to the returned value. Should typically be between [0, 0.20].
     * @return the exponential backoff in the same unit as base
     */
    public static long computeExponentialBackoff(long base, int retryNumber, int capRetries, double jitterFraction) {
        long backoff = computeExponentialBackoff(base, retryNumber, capRetries);
        double range = backoff * jitterFraction;
        double delta = ThreadLocalRandom.current().nextDouble() * range - (range / 2);
        return Math.round(backoff + delta);
    }

    /**
     * Return the smallest retry count at which the backoff reaches the given maximum,
     * so that callers can pass it as capRetries.
     */
    public static int retriesToReach(long base, long max) {
        if (base <= 0) {
            throw new IllegalArgumentException("base must be positive: " + base);
        }
        int retries = 1;
        long value = base;
        while (value < max && retries < 62) {
            value <<= 1;
            retries++;
        }
        return retries;
    }
}
