package org.carma.liquidity.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Hedge fund strategy profiles.
 *
 * Each profile fixes which market variables the strategy is primarily and
 * secondarily exposed to, how gross exposure splits across gilts, equities,
 * corporate bonds and futures basis trades, the gross leverage range and how
 * dependent the strategy is on repo funding.
 */
public enum HedgeFundStrategy {
    MACRO_RATES(
        EnumSet.of(MarketVariable.GILT_10Y_YIELD, MarketVariable.GILT_30Y_YIELD, MarketVariable.SONIA_SWAP),
        EnumSet.of(MarketVariable.UST_10Y_YIELD, MarketVariable.FX_GBPUSD),
        0.40, 0.05, 0.05, 0.0, 3.0, 8.0, RepoDependence.HIGH, 8),
    RELATIVE_VALUE(
        EnumSet.of(MarketVariable.GILT_10Y_YIELD, MarketVariable.GILT_30Y_YIELD, MarketVariable.BOND_FUTURES_BASIS),
        EnumSet.of(MarketVariable.SONIA_SWAP),
        0.30, 0.0, 0.0, 0.40, 5.0, 15.0, RepoDependence.VERY_HIGH, 8),
    LONG_SHORT_EQUITY(
        EnumSet.of(MarketVariable.EQUITY),
        EnumSet.noneOf(MarketVariable.class),
        0.0, 0.80, 0.0, 0.0, 1.5, 3.0, RepoDependence.LOW, 8),
    CREDIT_LONG_SHORT(
        EnumSet.of(MarketVariable.IG_CORP_SPREAD, MarketVariable.HY_CORP_SPREAD),
        EnumSet.of(MarketVariable.GILT_10Y_YIELD),
        0.0, 0.0, 0.60, 0.0, 2.0, 5.0, RepoDependence.MEDIUM, 5),
    MULTI_STRATEGY(
        EnumSet.of(MarketVariable.GILT_10Y_YIELD, MarketVariable.EQUITY, MarketVariable.IG_CORP_SPREAD),
        EnumSet.noneOf(MarketVariable.class),
        0.20, 0.20, 0.20, 0.0, 3.0, 7.0, RepoDependence.MEDIUM, 6);

    private final Set<MarketVariable> primary;
    private final Set<MarketVariable> secondary;
    private final double giltShare;
    private final double equityShare;
    private final double corpShare;
    private final double basisShare;
    private final double minLeverage;
    private final double maxLeverage;
    private final RepoDependence repoDependence;
    private final int populationWeight;

    HedgeFundStrategy(Set<MarketVariable> primary, Set<MarketVariable> secondary,
                      double giltShare, double equityShare, double corpShare, double basisShare,
                      double minLeverage, double maxLeverage,
                      RepoDependence repoDependence, int populationWeight) {
        this.primary = Collections.unmodifiableSet(primary);
        this.secondary = Collections.unmodifiableSet(secondary);
        this.giltShare = giltShare;
        this.equityShare = equityShare;
        this.corpShare = corpShare;
        this.basisShare = basisShare;
        this.minLeverage = minLeverage;
        this.maxLeverage = maxLeverage;
        this.repoDependence = repoDependence;
        this.populationWeight = populationWeight;
    }

    public Set<MarketVariable> getPrimarySensitivities() { return primary; }
    public Set<MarketVariable> getSecondarySensitivities() { return secondary; }
    public double getGiltShare() { return giltShare; }
    public double getEquityShare() { return equityShare; }
    public double getCorpShare() { return corpShare; }
    public double getBasisShare() { return basisShare; }
    public double getMinLeverage() { return minLeverage; }
    public double getMaxLeverage() { return maxLeverage; }
    public RepoDependence getRepoDependence() { return repoDependence; }

    /**
     * Relative frequency of the strategy in a generated population.
     */
    public int getPopulationWeight() { return populationWeight; }

    public boolean isPrimary(MarketVariable variable) {
        return primary.contains(variable);
    }

    public boolean isSecondary(MarketVariable variable) {
        return secondary.contains(variable);
    }
}
