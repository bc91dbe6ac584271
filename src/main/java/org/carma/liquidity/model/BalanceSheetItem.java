package org.carma.liquidity.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single balance sheet position in GBP millions.
 *
 * <p>The amount only changes through {@link #reduceBy(double)}, which is called
 * by the owner's realized-sale step at the end of a day.
 */
public class BalanceSheetItem {

    private final String name;
    private double amount;
    private final ItemCategory category;
    private final Map<MarketVariable, Double> sensitivities;
    private final boolean collateralEligible;
    private final boolean reactionInstrument;
    private final double haircutPct;

    public BalanceSheetItem(String name, double amount, ItemCategory category,
                            Map<MarketVariable, Double> sensitivities,
                            boolean collateralEligible, boolean reactionInstrument,
                            double haircutPct) {
        this.name = Objects.requireNonNull(name, "name");
        this.category = Objects.requireNonNull(category, "category");
        if (!Double.isFinite(amount) || amount < 0) {
            throw new IllegalArgumentException("Item '" + name + "' amount must be finite and >= 0: " + amount);
        }
        if (!Double.isFinite(haircutPct) || haircutPct < 0) {
            throw new IllegalArgumentException("Item '" + name + "' haircut must be finite and >= 0: " + haircutPct);
        }
        this.amount = amount;
        EnumMap<MarketVariable, Double> sens = new EnumMap<>(MarketVariable.class);
        if (sensitivities != null) {
            for (Map.Entry<MarketVariable, Double> e : sensitivities.entrySet()) {
                double c = e.getValue();
                if (!Double.isFinite(c)) {
                    throw new IllegalArgumentException("Item '" + name + "' has non-finite sensitivity to " + e.getKey());
                }
                sens.put(e.getKey(), c);
            }
        }
        this.sensitivities = Collections.unmodifiableMap(sens);
        this.collateralEligible = collateralEligible;
        this.reactionInstrument = reactionInstrument;
        this.haircutPct = haircutPct;
    }

    public static BalanceSheetItem of(String name, double amount, ItemCategory category) {
        return new BalanceSheetItem(name, amount, category, Map.of(), false, false, 0.0);
    }

    public static BalanceSheetItem of(String name, double amount, ItemCategory category,
                                      Map<MarketVariable, Double> sensitivities) {
        return new BalanceSheetItem(name, amount, category, sensitivities, false, false, 0.0);
    }

    /**
     * Tradeable liquid asset that can be sold by a waterfall.
     */
    public static BalanceSheetItem tradeable(String name, double amount,
                                             Map<MarketVariable, Double> sensitivities,
                                             boolean collateralEligible) {
        return new BalanceSheetItem(name, amount, ItemCategory.LIQUID_ASSET, sensitivities,
            collateralEligible, true, 0.0);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public String getName() {
        return name;
    }

    public double getAmount() {
        return amount;
    }

    public ItemCategory getCategory() {
        return category;
    }

    public Map<MarketVariable, Double> getSensitivities() {
        return sensitivities;
    }

    public double getSensitivity(MarketVariable variable) {
        return sensitivities.getOrDefault(variable, 0.0);
    }

    public boolean isCollateralEligible() {
        return collateralEligible;
    }

    public boolean isReactionInstrument() {
        return reactionInstrument;
    }

    public double getHaircutPct() {
        return haircutPct;
    }

    // ========================================================================
    // Mutation
    // ========================================================================

    /**
     * Reduce the position by a realized sale. The amount never goes below zero.
     *
     * @return the amount actually removed
     */
    public double reduceBy(double sold) {
        if (!Double.isFinite(sold) || sold < 0) {
            throw new IllegalArgumentException("Sale amount must be finite and >= 0: " + sold);
        }
        double removed = Math.min(sold, amount);
        amount -= removed;
        return removed;
    }

    @Override
    public String toString() {
        return String.format("BalanceSheetItem[%s, %.2f, %s]", name, amount, category);
    }
}
