package org.carma.liquidity.config;

/**
 * Sizing rule for one waterfall step.
 *
 * @param share   fraction of the remaining shortfall the step may take, in [0, 1]
 * @param ceiling fraction of the step's holding or capacity it may draw, >= 0
 */
public record ReactionCap(double share, double ceiling) {

    public ReactionCap {
        if (!Double.isFinite(share) || share < 0 || share > 1) {
            throw new IllegalArgumentException("Reaction share must be in [0, 1]: " + share);
        }
        if (!Double.isFinite(ceiling) || ceiling < 0) {
            throw new IllegalArgumentException("Reaction ceiling must be finite and >= 0: " + ceiling);
        }
    }

    public static ReactionCap of(double share, double ceiling) {
        return new ReactionCap(share, ceiling);
    }

    /**
     * Absolute ceiling for a holding or capacity of the given size.
     */
    public double ceilingFor(double base) {
        return base * ceiling;
    }
}
