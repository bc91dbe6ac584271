package org.carma.liquidity.config;

import java.util.Random;

/**
 * Closed interval [min, max] a generated parameter is drawn from.
 */
public record ParameterRange(double min, double max) {

    public ParameterRange {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new IllegalArgumentException("Range bounds must be finite: [" + min + ", " + max + "]");
        }
        if (min > max) {
            throw new IllegalArgumentException("Range min must not exceed max: [" + min + ", " + max + "]");
        }
    }

    public static ParameterRange of(double min, double max) {
        return new ParameterRange(min, max);
    }

    public double sample(Random random) {
        return min + random.nextDouble() * (max - min);
    }

    /**
     * Inclusive integer draw between the rounded bounds.
     */
    public int sampleInt(Random random) {
        int lo = (int) Math.round(min);
        int hi = (int) Math.round(max);
        return lo + random.nextInt(hi - lo + 1);
    }

    public double midpoint() {
        return (min + max) / 2.0;
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    @Override
    public String toString() {
        return String.format("[%s, %s]", min, max);
    }
}
