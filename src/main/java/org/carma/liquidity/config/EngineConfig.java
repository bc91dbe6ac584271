package org.carma.liquidity.config;

import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.Reaction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable engine configuration, loaded once before a run and passed to the
 * engine, the feedback layer and the agent behaviours at construction time.
 *
 * <h2>Parameter groups</h2>
 * <ul>
 *   <li>Feedback: iteration count and the coefficients of the bilateral,
 *       broadcast, reputation and crowding terms</li>
 *   <li>Repo provision: the bank stress ratio at which new repo dries up</li>
 *   <li>Stage 2: realisation efficiency per instrument class</li>
 *   <li>Fund complex gates: inflow threshold and throttle</li>
 *   <li>Reaction caps: (share, ceiling) for every waterfall step per agent type</li>
 * </ul>
 *
 * Population and network generation parameters ride along as {@link PopulationRanges}
 * and {@link NetworkRules} so that one file configures a full run.
 */
public class EngineConfig {

    // ========================================================================
    // Constants
    // ========================================================================

    /** Default configuration */
    public static final EngineConfig DEFAULT = new EngineConfig.Builder().build();

    // ========================================================================
    // Fields
    // ========================================================================

    private final int feedbackIterations;
    private final double vixBaseline;
    private final double bankRepoRefusalStressThreshold;

    private final double bankCounterpartyLossCoefficient;
    private final double hedgeFundFundingStressCoefficient;
    private final double redemptionPressureCoefficient;
    private final double broadcastCoefficient;
    private final double reputationCoefficient;
    private final double reputationExponent;
    private final double crowdingCoefficient;
    private final double crowdingExponent;

    private final double saleRealisationFloor;
    private final double centralBankEfficiency;
    private final double redemptionEfficiency;
    private final double otherEfficiency;

    private final double gateThreshold;
    private final double gateThrottle;

    private final double amplificationEpsilon;

    private final Map<AgentType, Map<Reaction, ReactionCap>> reactionCaps;
    private final ReactionCap multiStrategyCap;

    private final PopulationRanges populationRanges;
    private final NetworkRules networkRules;

    // ========================================================================
    // Constructor (via Builder)
    // ========================================================================

    private EngineConfig(Builder builder) {
        this.feedbackIterations = builder.feedbackIterations;
        this.vixBaseline = builder.vixBaseline;
        this.bankRepoRefusalStressThreshold = builder.bankRepoRefusalStressThreshold;
        this.bankCounterpartyLossCoefficient = builder.bankCounterpartyLossCoefficient;
        this.hedgeFundFundingStressCoefficient = builder.hedgeFundFundingStressCoefficient;
        this.redemptionPressureCoefficient = builder.redemptionPressureCoefficient;
        this.broadcastCoefficient = builder.broadcastCoefficient;
        this.reputationCoefficient = builder.reputationCoefficient;
        this.reputationExponent = builder.reputationExponent;
        this.crowdingCoefficient = builder.crowdingCoefficient;
        this.crowdingExponent = builder.crowdingExponent;
        this.saleRealisationFloor = builder.saleRealisationFloor;
        this.centralBankEfficiency = builder.centralBankEfficiency;
        this.redemptionEfficiency = builder.redemptionEfficiency;
        this.otherEfficiency = builder.otherEfficiency;
        this.gateThreshold = builder.gateThreshold;
        this.gateThrottle = builder.gateThrottle;
        this.amplificationEpsilon = builder.amplificationEpsilon;
        EnumMap<AgentType, Map<Reaction, ReactionCap>> caps = new EnumMap<>(AgentType.class);
        for (Map.Entry<AgentType, EnumMap<Reaction, ReactionCap>> e : builder.reactionCaps.entrySet()) {
            caps.put(e.getKey(), Collections.unmodifiableMap(new EnumMap<>(e.getValue())));
        }
        this.reactionCaps = Collections.unmodifiableMap(caps);
        this.multiStrategyCap = builder.multiStrategyCap;
        this.populationRanges = builder.populationRanges;
        this.networkRules = builder.networkRules;
    }

    // ========================================================================
    // Getters
    // ========================================================================

    /**
     * Number of Stage 3 iterations per day. Zero disables systemic feedback.
     */
    public int getFeedbackIterations() {
        return feedbackIterations;
    }

    /**
     * VIX level regarded as calm. Stress indices are VIX divided by this.
     */
    public double getVixBaseline() {
        return vixBaseline;
    }

    /**
     * Bank stress ratio E1/B0 at which a bank stops extending new repo.
     */
    public double getBankRepoRefusalStressThreshold() {
        return bankRepoRefusalStressThreshold;
    }

    public double getBankCounterpartyLossCoefficient() {
        return bankCounterpartyLossCoefficient;
    }

    public double getHedgeFundFundingStressCoefficient() {
        return hedgeFundFundingStressCoefficient;
    }

    public double getRedemptionPressureCoefficient() {
        return redemptionPressureCoefficient;
    }

    public double getBroadcastCoefficient() {
        return broadcastCoefficient;
    }

    public double getReputationCoefficient() {
        return reputationCoefficient;
    }

    /**
     * Exponent applied to the stress index in the reputation term (0.5 gives a square root).
     */
    public double getReputationExponent() {
        return reputationExponent;
    }

    public double getCrowdingCoefficient() {
        return crowdingCoefficient;
    }

    /**
     * Exponent applied to the same-type reacting fraction in the crowding term.
     */
    public double getCrowdingExponent() {
        return crowdingExponent;
    }

    public double getSaleRealisationFloor() {
        return saleRealisationFloor;
    }

    public double getCentralBankEfficiency() {
        return centralBankEfficiency;
    }

    public double getRedemptionEfficiency() {
        return redemptionEfficiency;
    }

    public double getOtherEfficiency() {
        return otherEfficiency;
    }

    /**
     * Cumulative redemption inflows, as a fraction of AUM, above which a fund complex
     * applies swing pricing.
     */
    public double getGateThreshold() {
        return gateThreshold;
    }

    /**
     * Fraction of redemption demand suppressed once a fund complex's gate is active.
     */
    public double getGateThrottle() {
        return gateThrottle;
    }

    public double getAmplificationEpsilon() {
        return amplificationEpsilon;
    }

    /**
     * Cap for one waterfall step of an agent type.
     * @throws IllegalStateException if no cap is configured for the pair
     */
    public ReactionCap getReactionCap(AgentType type, Reaction reaction) {
        Map<Reaction, ReactionCap> caps = reactionCaps.get(type);
        ReactionCap cap = caps == null ? null : caps.get(reaction);
        if (cap == null) {
            throw new IllegalStateException("No reaction cap configured for " + type.name() + "/" + reaction.name());
        }
        return cap;
    }

    public Map<AgentType, Map<Reaction, ReactionCap>> getReactionCaps() {
        return reactionCaps;
    }

    /**
     * Cap applied to each sale step of a multi-strategy hedge fund.
     */
    public ReactionCap getMultiStrategyCap() {
        return multiStrategyCap;
    }

    public PopulationRanges getPopulationRanges() {
        return populationRanges;
    }

    public NetworkRules getNetworkRules() {
        return networkRules;
    }

    /**
     * Create a builder pre-filled with this configuration's values.
     */
    public Builder toBuilder() {
        Builder b = new Builder()
            .feedbackIterations(feedbackIterations)
            .vixBaseline(vixBaseline)
            .bankRepoRefusalStressThreshold(bankRepoRefusalStressThreshold)
            .bankCounterpartyLossCoefficient(bankCounterpartyLossCoefficient)
            .hedgeFundFundingStressCoefficient(hedgeFundFundingStressCoefficient)
            .redemptionPressureCoefficient(redemptionPressureCoefficient)
            .broadcastCoefficient(broadcastCoefficient)
            .reputationCoefficient(reputationCoefficient)
            .reputationExponent(reputationExponent)
            .crowdingCoefficient(crowdingCoefficient)
            .crowdingExponent(crowdingExponent)
            .saleRealisationFloor(saleRealisationFloor)
            .centralBankEfficiency(centralBankEfficiency)
            .redemptionEfficiency(redemptionEfficiency)
            .otherEfficiency(otherEfficiency)
            .gateThreshold(gateThreshold)
            .gateThrottle(gateThrottle)
            .amplificationEpsilon(amplificationEpsilon)
            .multiStrategyCap(multiStrategyCap)
            .populationRanges(populationRanges)
            .networkRules(networkRules);
        for (Map.Entry<AgentType, Map<Reaction, ReactionCap>> e : reactionCaps.entrySet()) {
            for (Map.Entry<Reaction, ReactionCap> c : e.getValue().entrySet()) {
                b.reactionCap(e.getKey(), c.getKey(), c.getValue());
            }
        }
        return b;
    }

    @Override
    public String toString() {
        return String.format(
            "EngineConfig[iterations=%d, repoRefusal=%.4f, coefficients=(%.4f, %.3f, %.3f, %.3f, %.3f, %.3f), gate=%.2f/%.2f]",
            feedbackIterations, bankRepoRefusalStressThreshold,
            bankCounterpartyLossCoefficient, hedgeFundFundingStressCoefficient,
            redemptionPressureCoefficient, broadcastCoefficient,
            reputationCoefficient, crowdingCoefficient,
            gateThreshold, gateThrottle);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private int feedbackIterations = 3;
        private double vixBaseline = 15.0;
        private double bankRepoRefusalStressThreshold = 0.266353;
        private double bankCounterpartyLossCoefficient = 0.005;
        private double hedgeFundFundingStressCoefficient = 0.05;
        private double redemptionPressureCoefficient = 0.1;
        private double broadcastCoefficient = 0.05;
        private double reputationCoefficient = 0.15;
        private double reputationExponent = 0.5;
        private double crowdingCoefficient = 0.03;
        private double crowdingExponent = 2.0;
        private double saleRealisationFloor = 0.5;
        private double centralBankEfficiency = 0.95;
        private double redemptionEfficiency = 0.90;
        private double otherEfficiency = 0.80;
        private double gateThreshold = 0.15;
        private double gateThrottle = 0.5;
        private double amplificationEpsilon = 0.001;
        private final EnumMap<AgentType, EnumMap<Reaction, ReactionCap>> reactionCaps =
            new EnumMap<>(AgentType.class);
        private ReactionCap multiStrategyCap = ReactionCap.of(0.05, 0.03);
        private PopulationRanges populationRanges = PopulationRanges.DEFAULT;
        private NetworkRules networkRules = NetworkRules.DEFAULT;

        public Builder() {
            reactionCap(AgentType.BANK, Reaction.DRAW_CENTRAL_BANK_FACILITY, ReactionCap.of(0.30, 0.50));
            reactionCap(AgentType.BANK, Reaction.REDUCE_REPO_LENDING, ReactionCap.of(0.30, 0.30));
            reactionCap(AgentType.BANK, Reaction.SELL_GILT, ReactionCap.of(0.10, 0.20));
            reactionCap(AgentType.BANK, Reaction.SELL_CORP_BONDS, ReactionCap.of(0.08, 0.02));

            reactionCap(AgentType.HEDGE_FUND, Reaction.SEEK_REPO, ReactionCap.of(0.85, 1.0));
            reactionCap(AgentType.HEDGE_FUND, Reaction.SELL_GILT_BASIS_UNWIND, ReactionCap.of(0.10, 0.04));
            reactionCap(AgentType.HEDGE_FUND, Reaction.SELL_GILT, ReactionCap.of(0.10, 0.10));
            reactionCap(AgentType.HEDGE_FUND, Reaction.SELL_CORP_BONDS, ReactionCap.of(0.10, 0.025));
            reactionCap(AgentType.HEDGE_FUND, Reaction.SELL_EQUITY, ReactionCap.of(0.10, 0.025));
            reactionCap(AgentType.HEDGE_FUND, Reaction.REDEEM_FUND, ReactionCap.of(0.20, 0.05));

            reactionCap(AgentType.LDI_PENSION, Reaction.POST_COLLATERAL, ReactionCap.of(0.40, 0.50));
            reactionCap(AgentType.LDI_PENSION, Reaction.RECAPITALISATION, ReactionCap.of(0.30, 1.0));
            reactionCap(AgentType.LDI_PENSION, Reaction.SELL_GILT, ReactionCap.of(0.15, 0.15));
            reactionCap(AgentType.LDI_PENSION, Reaction.SELL_IL_GILT, ReactionCap.of(0.08, 0.02));
            reactionCap(AgentType.LDI_PENSION, Reaction.SELL_CORP_BONDS, ReactionCap.of(0.05, 0.015));
            reactionCap(AgentType.LDI_PENSION, Reaction.SEEK_REPO, ReactionCap.of(0.85, 1.0));
            reactionCap(AgentType.LDI_PENSION, Reaction.REDEEM_FUND, ReactionCap.of(0.20, 0.05));

            reactionCap(AgentType.INSURER, Reaction.DRAW_REPO_LINE, ReactionCap.of(0.30, 0.50));
            reactionCap(AgentType.INSURER, Reaction.DRAW_CREDIT_FACILITY, ReactionCap.of(0.20, 0.50));
            reactionCap(AgentType.INSURER, Reaction.SELL_GILT, ReactionCap.of(0.15, 0.10));
            reactionCap(AgentType.INSURER, Reaction.SELL_CORP_BONDS, ReactionCap.of(0.08, 0.02));
            reactionCap(AgentType.INSURER, Reaction.SELL_EQUITY, ReactionCap.of(0.05, 0.025));
            reactionCap(AgentType.INSURER, Reaction.SEEK_REPO, ReactionCap.of(0.80, 1.0));
            reactionCap(AgentType.INSURER, Reaction.REDEEM_FUND, ReactionCap.of(0.15, 0.03));

            reactionCap(AgentType.FUND_COMPLEX, Reaction.USE_CASH_BUFFER, ReactionCap.of(1.0, 1.0));
            reactionCap(AgentType.FUND_COMPLEX, Reaction.SELL_GILT, ReactionCap.of(1.0, 0.20));
            reactionCap(AgentType.FUND_COMPLEX, Reaction.SELL_CORP_BONDS, ReactionCap.of(1.0, 0.02));
            reactionCap(AgentType.FUND_COMPLEX, Reaction.SWING_PRICING, ReactionCap.of(0.20, 1.0));
        }

        public Builder feedbackIterations(int iterations) {
            if (iterations < 0) {
                throw new IllegalArgumentException("Feedback iterations must be >= 0");
            }
            this.feedbackIterations = iterations;
            return this;
        }

        public Builder vixBaseline(double vix) {
            this.vixBaseline = positive("vixBaseline", vix);
            return this;
        }

        public Builder bankRepoRefusalStressThreshold(double threshold) {
            this.bankRepoRefusalStressThreshold = positive("bankRepoRefusalStressThreshold", threshold);
            return this;
        }

        public Builder bankCounterpartyLossCoefficient(double c) {
            this.bankCounterpartyLossCoefficient = nonNegative("bankCounterpartyLossCoefficient", c);
            return this;
        }

        public Builder hedgeFundFundingStressCoefficient(double c) {
            this.hedgeFundFundingStressCoefficient = nonNegative("hedgeFundFundingStressCoefficient", c);
            return this;
        }

        public Builder redemptionPressureCoefficient(double c) {
            this.redemptionPressureCoefficient = nonNegative("redemptionPressureCoefficient", c);
            return this;
        }

        public Builder broadcastCoefficient(double c) {
            this.broadcastCoefficient = nonNegative("broadcastCoefficient", c);
            return this;
        }

        public Builder reputationCoefficient(double c) {
            this.reputationCoefficient = nonNegative("reputationCoefficient", c);
            return this;
        }

        public Builder reputationExponent(double e) {
            this.reputationExponent = positive("reputationExponent", e);
            return this;
        }

        public Builder crowdingCoefficient(double c) {
            this.crowdingCoefficient = nonNegative("crowdingCoefficient", c);
            return this;
        }

        public Builder crowdingExponent(double e) {
            this.crowdingExponent = positive("crowdingExponent", e);
            return this;
        }

        public Builder saleRealisationFloor(double floor) {
            this.saleRealisationFloor = fraction("saleRealisationFloor", floor);
            return this;
        }

        public Builder centralBankEfficiency(double e) {
            this.centralBankEfficiency = fraction("centralBankEfficiency", e);
            return this;
        }

        public Builder redemptionEfficiency(double e) {
            this.redemptionEfficiency = fraction("redemptionEfficiency", e);
            return this;
        }

        public Builder otherEfficiency(double e) {
            this.otherEfficiency = fraction("otherEfficiency", e);
            return this;
        }

        public Builder gateThreshold(double threshold) {
            this.gateThreshold = nonNegative("gateThreshold", threshold);
            return this;
        }

        public Builder gateThrottle(double throttle) {
            this.gateThrottle = fraction("gateThrottle", throttle);
            return this;
        }

        public Builder amplificationEpsilon(double epsilon) {
            this.amplificationEpsilon = positive("amplificationEpsilon", epsilon);
            return this;
        }

        public Builder reactionCap(AgentType type, Reaction reaction, ReactionCap cap) {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(reaction, "reaction");
            Objects.requireNonNull(cap, "cap");
            reactionCaps.computeIfAbsent(type, k -> new EnumMap<>(Reaction.class)).put(reaction, cap);
            return this;
        }

        public Builder multiStrategyCap(ReactionCap cap) {
            this.multiStrategyCap = Objects.requireNonNull(cap, "cap");
            return this;
        }

        public Builder populationRanges(PopulationRanges ranges) {
            this.populationRanges = Objects.requireNonNull(ranges, "ranges");
            return this;
        }

        public Builder networkRules(NetworkRules rules) {
            this.networkRules = Objects.requireNonNull(rules, "rules");
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }

        private static double positive(String name, double value) {
            if (!Double.isFinite(value) || value <= 0) {
                throw new IllegalArgumentException(name + " must be finite and > 0: " + value);
            }
            return value;
        }

        private static double nonNegative(String name, double value) {
            if (!Double.isFinite(value) || value < 0) {
                throw new IllegalArgumentException(name + " must be finite and >= 0: " + value);
            }
            return value;
        }

        private static double fraction(String name, double value) {
            if (!Double.isFinite(value) || value < 0 || value > 1) {
                throw new IllegalArgumentException(name + " must be in [0, 1]: " + value);
            }
            return value;
        }
    }
}
