package org.carma.liquidity.model;

/**
 * Balance sheet category of a single position.
 */
public enum ItemCategory {
    LIQUID_ASSET,
    ILLIQUID_ASSET,
    LIABILITY,
    EQUITY,
    OFF_BALANCE_SHEET;

    public boolean isAsset() {
        return this == LIQUID_ASSET || this == ILLIQUID_ASSET;
    }
}
