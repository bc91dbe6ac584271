package org.carma.liquidity.config;

/**
 * Degree ranges used when generating the relationship network.
 * Bank in-degrees are not configured; they emerge from the non-bank draws.
 */
public class NetworkRules {

    /** Default rules */
    public static final NetworkRules DEFAULT = new NetworkRules.Builder().build();

    private final ParameterRange hedgeFundBankDegree;
    private final ParameterRange ldiBankDegree;
    private final ParameterRange insurerBankDegree;
    private final ParameterRange nonBankFundDegree;
    private final ParameterRange fundFundDegree;

    private NetworkRules(Builder builder) {
        this.hedgeFundBankDegree = builder.hedgeFundBankDegree;
        this.ldiBankDegree = builder.ldiBankDegree;
        this.insurerBankDegree = builder.insurerBankDegree;
        this.nonBankFundDegree = builder.nonBankFundDegree;
        this.fundFundDegree = builder.fundFundDegree;
    }

    /** Prime brokerage banks per hedge fund. */
    public ParameterRange getHedgeFundBankDegree() {
        return hedgeFundBankDegree;
    }

    /** Clearing banks per LDI fund. */
    public ParameterRange getLdiBankDegree() {
        return ldiBankDegree;
    }

    /** Derivatives/repo banks per insurer. */
    public ParameterRange getInsurerBankDegree() {
        return insurerBankDegree;
    }

    /** Fund complexes each hedge fund, LDI fund or insurer redeems from. */
    public ParameterRange getNonBankFundDegree() {
        return nonBankFundDegree;
    }

    /** Other fund complexes each fund complex redeems from. */
    public ParameterRange getFundFundDegree() {
        return fundFundDegree;
    }

    @Override
    public String toString() {
        return String.format("NetworkRules[hf-bank=%s, ldi-bank=%s, insurer-bank=%s, nonbank-fund=%s, fund-fund=%s]",
            hedgeFundBankDegree, ldiBankDegree, insurerBankDegree, nonBankFundDegree, fundFundDegree);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private ParameterRange hedgeFundBankDegree = ParameterRange.of(2, 3);
        private ParameterRange ldiBankDegree = ParameterRange.of(1, 2);
        private ParameterRange insurerBankDegree = ParameterRange.of(1, 3);
        private ParameterRange nonBankFundDegree = ParameterRange.of(1, 3);
        private ParameterRange fundFundDegree = ParameterRange.of(0, 1);

        public Builder hedgeFundBankDegree(int min, int max) {
            this.hedgeFundBankDegree = degree(min, max);
            return this;
        }

        public Builder ldiBankDegree(int min, int max) {
            this.ldiBankDegree = degree(min, max);
            return this;
        }

        public Builder insurerBankDegree(int min, int max) {
            this.insurerBankDegree = degree(min, max);
            return this;
        }

        public Builder nonBankFundDegree(int min, int max) {
            this.nonBankFundDegree = degree(min, max);
            return this;
        }

        public Builder fundFundDegree(int min, int max) {
            this.fundFundDegree = degree(min, max);
            return this;
        }

        public NetworkRules build() {
            return new NetworkRules(this);
        }

        private static ParameterRange degree(int min, int max) {
            if (min < 0) {
                throw new IllegalArgumentException("Degree must be >= 0: " + min);
            }
            return ParameterRange.of(min, max);
        }
    }
}
