package org.carma.liquidity.model;

/**
 * How heavily a hedge fund strategy relies on repo funding.
 */
public enum RepoDependence {
    LOW(0.2),
    MEDIUM(0.5),
    HIGH(0.8),
    VERY_HIGH(1.0);

    private final double weight;

    RepoDependence(double weight) {
        this.weight = weight;
    }

    public double getWeight() {
        return weight;
    }
}
