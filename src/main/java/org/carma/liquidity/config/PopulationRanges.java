package org.carma.liquidity.config;

import org.carma.liquidity.model.AgentType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable parameter ranges for population generation.
 *
 * Per agent type: population count, reaction threshold θ, buffer usability u and
 * size (balance sheet, AUM or total assets, GBP millions). Variant specific
 * behavioural and composition parameters are listed in {@link Parameter}.
 */
public class PopulationRanges {

    /** Default ranges: 70 agents */
    public static final PopulationRanges DEFAULT = new PopulationRanges.Builder().build();

    /**
     * Variant specific parameters drawn per agent.
     */
    public enum Parameter {
        BANK_RISK_APPETITE(0.30, 0.80),
        BANK_GILT_MARKET_MAKING_MM(500.0, 5000.0),
        BANK_REPO_CAPACITY_PCT_OF_BS(0.03, 0.08),
        BANK_REPO_WILLINGNESS_NEW(0.50, 0.90),
        BANK_REPO_WILLINGNESS_ROLL(0.70, 0.95),
        HEDGE_FUND_VAR_UTILISATION(0.50, 0.95),
        LDI_LEVERAGE(2.0, 4.0),
        LDI_YIELD_BUFFER_BPS(100.0, 250.0),
        LDI_POOLED_SHARE(0.60, 0.60),
        LDI_RECAP_AVAILABLE_PCT_OF_AUM(0.05, 0.20),
        LDI_RECAP_SPEED_DAYS(2.0, 5.0),
        LDI_TRUSTEE_LAG_DAYS(1.0, 3.0),
        INSURER_HEDGE_RATIO(0.50, 0.95),
        INSURER_DIRTY_CSA(0.0, 0.40),
        FUND_PENSION_INVESTOR_SHARE(0.10, 0.40),
        FUND_INSURER_INVESTOR_SHARE(0.05, 0.25),
        FUND_CASH_BUFFER_PCT(0.02, 0.10);

        private final ParameterRange defaultRange;

        Parameter(double min, double max) {
            this.defaultRange = ParameterRange.of(min, max);
        }

        public ParameterRange getDefaultRange() {
            return defaultRange;
        }
    }

    private final Map<AgentType, Integer> counts;
    private final Map<AgentType, ParameterRange> thetas;
    private final Map<AgentType, ParameterRange> bufferUsabilities;
    private final Map<AgentType, ParameterRange> sizes;
    private final Map<Parameter, ParameterRange> parameters;

    private PopulationRanges(Builder builder) {
        this.counts = Collections.unmodifiableMap(new EnumMap<>(builder.counts));
        this.thetas = Collections.unmodifiableMap(new EnumMap<>(builder.thetas));
        this.bufferUsabilities = Collections.unmodifiableMap(new EnumMap<>(builder.bufferUsabilities));
        this.sizes = Collections.unmodifiableMap(new EnumMap<>(builder.sizes));
        this.parameters = Collections.unmodifiableMap(new EnumMap<>(builder.parameters));
    }

    public int getCount(AgentType type) {
        return counts.getOrDefault(type, 0);
    }

    public int getTotalCount() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public ParameterRange getTheta(AgentType type) {
        return thetas.get(type);
    }

    public ParameterRange getBufferUsability(AgentType type) {
        return bufferUsabilities.get(type);
    }

    public ParameterRange getSize(AgentType type) {
        return sizes.get(type);
    }

    public ParameterRange get(Parameter parameter) {
        return parameters.get(parameter);
    }

    public Map<AgentType, Integer> getCounts() {
        return counts;
    }

    @Override
    public String toString() {
        return String.format("PopulationRanges[counts=%s, total=%d]", counts, getTotalCount());
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private final EnumMap<AgentType, Integer> counts = new EnumMap<>(AgentType.class);
        private final EnumMap<AgentType, ParameterRange> thetas = new EnumMap<>(AgentType.class);
        private final EnumMap<AgentType, ParameterRange> bufferUsabilities = new EnumMap<>(AgentType.class);
        private final EnumMap<AgentType, ParameterRange> sizes = new EnumMap<>(AgentType.class);
        private final EnumMap<Parameter, ParameterRange> parameters = new EnumMap<>(Parameter.class);

        public Builder() {
            counts.put(AgentType.BANK, 12);
            counts.put(AgentType.HEDGE_FUND, 35);
            counts.put(AgentType.LDI_PENSION, 10);
            counts.put(AgentType.INSURER, 6);
            counts.put(AgentType.FUND_COMPLEX, 7);

            thetas.put(AgentType.BANK, ParameterRange.of(0.35, 0.45));
            thetas.put(AgentType.HEDGE_FUND, ParameterRange.of(0.20, 0.30));
            thetas.put(AgentType.LDI_PENSION, ParameterRange.of(0.25, 0.35));
            thetas.put(AgentType.INSURER, ParameterRange.of(0.40, 0.50));
            thetas.put(AgentType.FUND_COMPLEX, ParameterRange.of(0.15, 0.25));

            bufferUsabilities.put(AgentType.BANK, ParameterRange.of(0.30, 0.70));
            bufferUsabilities.put(AgentType.HEDGE_FUND, ParameterRange.of(0.10, 0.30));
            bufferUsabilities.put(AgentType.LDI_PENSION, ParameterRange.of(0.20, 0.50));
            bufferUsabilities.put(AgentType.INSURER, ParameterRange.of(0.40, 0.70));
            bufferUsabilities.put(AgentType.FUND_COMPLEX, ParameterRange.of(0.10, 0.20));

            sizes.put(AgentType.BANK, ParameterRange.of(20_000, 300_000));
            sizes.put(AgentType.HEDGE_FUND, ParameterRange.of(500, 15_000));
            sizes.put(AgentType.LDI_PENSION, ParameterRange.of(2_000, 40_000));
            sizes.put(AgentType.INSURER, ParameterRange.of(10_000, 150_000));
            sizes.put(AgentType.FUND_COMPLEX, ParameterRange.of(5_000, 60_000));

            for (Parameter p : Parameter.values()) {
                parameters.put(p, p.getDefaultRange());
            }
        }

        public Builder count(AgentType type, int count) {
            if (count < 0) {
                throw new IllegalArgumentException("Count for " + type + " must be >= 0: " + count);
            }
            counts.put(Objects.requireNonNull(type), count);
            return this;
        }

        public Builder theta(AgentType type, double min, double max) {
            if (min <= 0) {
                throw new IllegalArgumentException("Theta for " + type + " must be > 0: " + min);
            }
            thetas.put(Objects.requireNonNull(type), ParameterRange.of(min, max));
            return this;
        }

        public Builder bufferUsability(AgentType type, double min, double max) {
            if (min < 0 || max > 1) {
                throw new IllegalArgumentException("Buffer usability for " + type + " must lie in [0, 1]");
            }
            bufferUsabilities.put(Objects.requireNonNull(type), ParameterRange.of(min, max));
            return this;
        }

        public Builder size(AgentType type, double min, double max) {
            if (min <= 0) {
                throw new IllegalArgumentException("Size for " + type + " must be > 0: " + min);
            }
            sizes.put(Objects.requireNonNull(type), ParameterRange.of(min, max));
            return this;
        }

        public Builder parameter(Parameter parameter, double min, double max) {
            if (min < 0) {
                throw new IllegalArgumentException(parameter + " must be >= 0: " + min);
            }
            parameters.put(Objects.requireNonNull(parameter), ParameterRange.of(min, max));
            return this;
        }

        public PopulationRanges build() {
            return new PopulationRanges(this);
        }
    }
}
