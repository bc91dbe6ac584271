package org.carma.liquidity.model;

/**
 * Asset classes whose selling pressure is tracked by the market state.
 */
public enum AssetClass {
    GILT("Gilts"),
    CORPORATE_BOND("Corporate Bonds"),
    EQUITY("Equities");

    private final String displayName;

    AssetClass(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
