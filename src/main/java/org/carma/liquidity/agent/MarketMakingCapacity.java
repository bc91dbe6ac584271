package org.carma.liquidity.agent;

import org.carma.liquidity.model.AssetClass;

import java.util.EnumMap;
import java.util.Map;

/**
 * A bank's dealer balance sheet for absorbing client selling.
 *
 * Tracks total capacity and remaining capacity per asset class. Capacity is
 * cumulative over the run and never replenishes: whatever is absorbed on one
 * day is gone for the next.
 */
public class MarketMakingCapacity {

    private final Map<AssetClass, Double> totalCapacity;
    private final Map<AssetClass, Double> remaining;

    public MarketMakingCapacity(Map<AssetClass, Double> capacity) {
        this.totalCapacity = new EnumMap<>(AssetClass.class);
        this.remaining = new EnumMap<>(AssetClass.class);
        for (Map.Entry<AssetClass, Double> e : capacity.entrySet()) {
            double c = e.getValue();
            if (!Double.isFinite(c) || c < 0) {
                throw new IllegalArgumentException("Capacity for " + e.getKey() + " must be finite and >= 0: " + c);
            }
            totalCapacity.put(e.getKey(), c);
            remaining.put(e.getKey(), c);
        }
    }

    /**
     * Capacity for gilts and corporate bonds.
     */
    public static MarketMakingCapacity of(double gilt, double corporate) {
        Map<AssetClass, Double> cap = new EnumMap<>(AssetClass.class);
        cap.put(AssetClass.GILT, gilt);
        cap.put(AssetClass.CORPORATE_BOND, corporate);
        return new MarketMakingCapacity(cap);
    }

    // ========================================================================
    // Capacity Queries
    // ========================================================================

    public double getCapacity(AssetClass assetClass) {
        return totalCapacity.getOrDefault(assetClass, 0.0);
    }

    public double getRemaining(AssetClass assetClass) {
        return remaining.getOrDefault(assetClass, 0.0);
    }

    public double getAbsorbed(AssetClass assetClass) {
        return getCapacity(assetClass) - getRemaining(assetClass);
    }

    /**
     * Consumed fraction of capacity (0.0 to 1.0).
     */
    public double getUtilization(AssetClass assetClass) {
        double cap = getCapacity(assetClass);
        if (cap == 0) return 0.0;
        return 1.0 - getRemaining(assetClass) / cap;
    }

    // ========================================================================
    // Absorption
    // ========================================================================

    /**
     * Absorb selling of one asset class.
     *
     * @param amount   selling offered to this bank
     * @param appetite fraction of remaining capacity the bank is willing to use
     * @return absorbed amount, {@code min(amount, remaining × appetite)}
     */
    public double absorb(AssetClass assetClass, double amount, double appetite) {
        if (!Double.isFinite(amount) || amount < 0) {
            throw new IllegalArgumentException("Selling offered must be finite and >= 0: " + amount);
        }
        double current = getRemaining(assetClass);
        double absorbed = Math.min(amount, current * appetite);
        if (absorbed <= 0) {
            return 0.0;
        }
        remaining.put(assetClass, Math.max(0.0, current - absorbed));
        return absorbed;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("MarketMakingCapacity[");
        for (AssetClass c : totalCapacity.keySet()) {
            sb.append(String.format(" %s: %.1f/%.1f (%.1f%% used)",
                c.name(), getRemaining(c), getCapacity(c), getUtilization(c) * 100));
        }
        return sb.append(" ]").toString();
    }
}
