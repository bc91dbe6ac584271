package org.carma.liquidity.market;

import org.carma.liquidity.model.AssetClass;
import org.carma.liquidity.model.MarketVariable;

import java.util.EnumMap;
import java.util.Map;

/**
 * Market conditions for the current day: exogenous scenario levels plus the
 * endogenous accumulators fed by agent actions.
 *
 * The market state is the only shared mutable state of a run. Agents read it;
 * only the simulation loop (registration, absorption) and the feedback step
 * write to it. Accumulators reset when a new day's scenario levels are applied.
 *
 * Units: yields, spreads and basis in bps (cumulative change), equity, FX and
 * haircuts in percent (cumulative change), VIX as a level, amounts in GBP millions.
 */
public class MarketState {

    // ========================================================================
    // Calibration Constants
    // ========================================================================

    public static final double NORMAL_GILT_BID_ASK_BPS = 2.0;
    public static final double NORMAL_CORP_BID_ASK_BPS = 5.0;
    public static final double NORMAL_GILT_DEPTH = 5000.0;
    public static final double NORMAL_CORP_DEPTH = 2000.0;
    public static final double MIN_GILT_DEPTH = 1000.0;
    public static final double MIN_CORP_DEPTH = 500.0;
    public static final double MIN_REPO_AVAILABILITY = 0.5;
    public static final double SYSTEM_REPO_CAPACITY = 50_000.0;

    private static final double GILT_IMPACT_PER_DEPTH = 20.0;
    private static final double CORP_IMPACT_PER_DEPTH = 30.0;

    private final double vixBaseline;

    private int day;
    private final EnumMap<MarketVariable, Double> levels;

    private double giltBidAskBps;
    private double corpBidAskBps;
    private double repoAvailability;
    private double giltDepth;
    private double corpDepth;

    private final EnumMap<AssetClass, Double> sellingPressure;
    private final EnumMap<AssetClass, Double> absorbed;
    private final EnumMap<AssetClass, Double> remainingDealerCapacity;
    private double repoDemand;
    private double endogenousGiltYieldAddBps;
    private double endogenousIgSpreadAddBps;

    public MarketState(double vixBaseline) {
        if (!(vixBaseline > 0)) {
            throw new IllegalArgumentException("VIX baseline must be > 0: " + vixBaseline);
        }
        this.vixBaseline = vixBaseline;
        this.levels = new EnumMap<>(MarketVariable.class);
        for (MarketVariable v : MarketVariable.values()) {
            levels.put(v, v.getNeutralLevel());
        }
        this.sellingPressure = new EnumMap<>(AssetClass.class);
        this.absorbed = new EnumMap<>(AssetClass.class);
        this.remainingDealerCapacity = new EnumMap<>(AssetClass.class);
        this.giltBidAskBps = NORMAL_GILT_BID_ASK_BPS;
        this.corpBidAskBps = NORMAL_CORP_BID_ASK_BPS;
        this.repoAvailability = 1.0;
        this.giltDepth = NORMAL_GILT_DEPTH;
        this.corpDepth = NORMAL_CORP_DEPTH;
        resetAccumulators();
    }

    public MarketState() {
        this(15.0);
    }

    // ========================================================================
    // Day Transitions
    // ========================================================================

    /**
     * Apply a day's exogenous levels. Variables missing from the map take their
     * neutral level (VIX 15, everything else 0). Endogenous accumulators reset
     * and market functioning indicators are re-derived from VIX.
     */
    public void applyExogenous(int day, Map<MarketVariable, Double> dayLevels) {
        this.day = day;
        for (MarketVariable v : MarketVariable.values()) {
            Double value = dayLevels.get(v);
            levels.put(v, value != null ? value : v.getNeutralLevel());
        }
        resetAccumulators();

        double ratio = volatilityRatio();
        giltBidAskBps = NORMAL_GILT_BID_ASK_BPS * ratio;
        corpBidAskBps = NORMAL_CORP_BID_ASK_BPS * ratio;
        repoAvailability = Math.max(MIN_REPO_AVAILABILITY, 1.0 - (ratio - 1.0) * 0.15);
    }

    private void resetAccumulators() {
        for (AssetClass c : AssetClass.values()) {
            sellingPressure.put(c, 0.0);
            absorbed.put(c, 0.0);
        }
        repoDemand = 0.0;
        endogenousGiltYieldAddBps = 0.0;
        endogenousIgSpreadAddBps = 0.0;
    }

    /**
     * Convert unabsorbed selling into yield and spread moves, repo demand into
     * lower repo availability, and widen bid/ask spreads. Called once per
     * feedback iteration; each call adds to the day's moves.
     */
    public void applyEndogenousFeedback() {
        double giltUnabsorbed = getUnabsorbedSelling(AssetClass.GILT);
        if (giltDepth > 0) {
            double impact = giltUnabsorbed / giltDepth * GILT_IMPACT_PER_DEPTH;
            endogenousGiltYieldAddBps += impact;
            add(MarketVariable.GILT_10Y_YIELD, impact * 0.5);
            add(MarketVariable.GILT_30Y_YIELD, impact * 0.7);
        }

        double corpUnabsorbed = getUnabsorbedSelling(AssetClass.CORPORATE_BOND);
        if (corpDepth > 0) {
            double impact = corpUnabsorbed / corpDepth * CORP_IMPACT_PER_DEPTH;
            endogenousIgSpreadAddBps += impact;
            add(MarketVariable.IG_CORP_SPREAD, impact * 0.6);
            add(MarketVariable.HY_CORP_SPREAD, impact * 1.2);
        }

        double repoPressure = repoDemand / SYSTEM_REPO_CAPACITY;
        repoAvailability = Math.max(MIN_REPO_AVAILABILITY, repoAvailability - repoPressure * 0.25);

        giltBidAskBps += giltUnabsorbed * 0.001;
        corpBidAskBps += corpUnabsorbed * 0.002;

        // Dealers pull back as volatility rises
        double stress = volatilityRatio();
        giltDepth = Math.max(MIN_GILT_DEPTH, NORMAL_GILT_DEPTH / stress);
        corpDepth = Math.max(MIN_CORP_DEPTH, NORMAL_CORP_DEPTH / stress);
    }

    private void add(MarketVariable variable, double delta) {
        levels.merge(variable, delta, Double::sum);
    }

    // ========================================================================
    // Registration (written by the simulation loop)
    // ========================================================================

    public void registerSelling(AssetClass assetClass, double amount) {
        requireNonNegative("selling", amount);
        sellingPressure.merge(assetClass, amount, Double::sum);
    }

    public void registerRepoDemand(double amount) {
        requireNonNegative("repo demand", amount);
        repoDemand += amount;
    }

    public void recordAbsorbed(AssetClass assetClass, double amount) {
        requireNonNegative("absorbed", amount);
        absorbed.merge(assetClass, amount, Double::sum);
    }

    public void setRemainingDealerCapacity(AssetClass assetClass, double remaining) {
        requireNonNegative("dealer capacity", remaining);
        remainingDealerCapacity.put(assetClass, remaining);
    }

    private static void requireNonNegative(String what, double amount) {
        if (!Double.isFinite(amount) || amount < 0) {
            throw new IllegalArgumentException("Market " + what + " must be finite and >= 0: " + amount);
        }
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public int getDay() {
        return day;
    }

    public double level(MarketVariable variable) {
        return levels.get(variable);
    }

    public double getVix() {
        return levels.get(MarketVariable.VIX);
    }

    /**
     * VIX relative to its calm baseline. May fall below 1 in calm markets.
     */
    public double volatilityRatio() {
        return getVix() / vixBaseline;
    }

    /**
     * Stress index max(1, VIX / baseline).
     */
    public double stressIndex() {
        return Math.max(1.0, volatilityRatio());
    }

    public double getVixBaseline() {
        return vixBaseline;
    }

    public double getGiltBidAskBps() {
        return giltBidAskBps;
    }

    public double getCorpBidAskBps() {
        return corpBidAskBps;
    }

    public double getRepoAvailability() {
        return repoAvailability;
    }

    public double getGiltDepth() {
        return giltDepth;
    }

    public double getCorpDepth() {
        return corpDepth;
    }

    public double getSellingPressure(AssetClass assetClass) {
        return sellingPressure.getOrDefault(assetClass, 0.0);
    }

    public double getAbsorbed(AssetClass assetClass) {
        return absorbed.getOrDefault(assetClass, 0.0);
    }

    public double getUnabsorbedSelling(AssetClass assetClass) {
        return Math.max(0.0, getSellingPressure(assetClass) - getAbsorbed(assetClass));
    }

    public double getRemainingDealerCapacity(AssetClass assetClass) {
        return remainingDealerCapacity.getOrDefault(assetClass, 0.0);
    }

    public double getRepoDemand() {
        return repoDemand;
    }

    public double getEndogenousGiltYieldAddBps() {
        return endogenousGiltYieldAddBps;
    }

    public double getEndogenousIgSpreadAddBps() {
        return endogenousIgSpreadAddBps;
    }

    public MarketSnapshot snapshot() {
        return new MarketSnapshot(day, levels, giltBidAskBps, corpBidAskBps, repoAvailability,
            giltDepth, corpDepth, sellingPressure, absorbed, repoDemand,
            endogenousGiltYieldAddBps, endogenousIgSpreadAddBps, remainingDealerCapacity);
    }

    @Override
    public String toString() {
        return String.format("MarketState[day=%d, gilt10y=%+.1fbps, ig=%+.1fbps, vix=%.1f, repo=%.2f, giltSell=%.1f]",
            day, level(MarketVariable.GILT_10Y_YIELD), level(MarketVariable.IG_CORP_SPREAD),
            getVix(), repoAvailability, getSellingPressure(AssetClass.GILT));
    }
}
