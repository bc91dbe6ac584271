package org.carma.liquidity.agent;

import org.carma.liquidity.config.EngineConfig;
import org.carma.liquidity.config.ReactionCap;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.BalanceSheetItem;
import org.carma.liquidity.model.ItemCategory;
import org.carma.liquidity.model.MarketVariable;
import org.carma.liquidity.model.Reaction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fund complex (open-ended funds and money market funds).
 *
 * <p>No margin calls: its stress is the redemption demand routed from
 * stressed investors that hold units in it. Once cumulative redemptions pass
 * the gate threshold the fund applies swing pricing, which throttles future
 * redemption demand.
 */
public final class FundComplexBehavior implements AgentBehavior {

    public static final String GILT_HOLDINGS = "Gilt Holdings";
    public static final String CORPORATE_BONDS = "Corporate Bond Holdings";
    public static final String ABS_HOLDINGS = "ABS Holdings";
    public static final String CASH_BUFFER = "Cash Buffer";

    private final double aum;
    private final double pensionInvestorShare;
    private final double insurerInvestorShare;

    private double cumulativeInflows;
    private boolean gateActive;

    private FundComplexBehavior(Builder builder) {
        this.aum = builder.giltHoldings + builder.corporateBonds + builder.absHoldings + builder.cash;
        this.pensionInvestorShare = builder.pensionInvestorShare;
        this.insurerInvestorShare = builder.insurerInvestorShare;
    }

    @Override
    public AgentType type() {
        return AgentType.FUND_COMPLEX;
    }

    @Override
    public double weightedBuffer(Agent agent) {
        return agent.itemAmount(CASH_BUFFER) * 0.5;
    }

    @Override
    public double bufferFloor(Agent agent) {
        return aum * 0.01;
    }

    @Override
    public double marginCalls(Agent agent, StepContext ctx) {
        return 0.0;
    }

    @Override
    public double ownOutflows(Agent agent, StepContext ctx) {
        return 0.0;
    }

    /**
     * Redemption demand from connected investors whose direct stress today
     * exceeds their effective threshold. Reads the investors' direct stress, so
     * every agent's direct losses must be in place first.
     */
    @Override
    public double redemptionDemand(Agent agent, StepContext ctx) {
        double demand = 0.0;
        for (String redeemerId : ctx.network().redeemersOf(agent.getId())) {
            Agent redeemer = ctx.agent(redeemerId);
            double stress = redeemer.getLiquidity().directStressRatio();
            if (stress > redeemer.getEffectiveThreshold()) {
                demand += redeemer.getSizeFactor() * 0.001 * stress * investorFactor(redeemer.getType());
            }
        }
        if (gateActive) {
            demand *= 1.0 - ctx.config().getGateThrottle();
        }
        cumulativeInflows += demand;
        return demand;
    }

    private double investorFactor(AgentType redeemerType) {
        return switch (redeemerType) {
            case LDI_PENSION -> pensionInvestorShare * 2.0;
            case INSURER -> insurerInvestorShare * 1.5;
            case HEDGE_FUND, FUND_COMPLEX -> 0.5;
            default -> 0.0;
        };
    }

    @Override
    public void buildWaterfall(Agent agent, StepContext ctx, Waterfall waterfall) {
        EngineConfig config = ctx.config();

        waterfall.step(Reaction.USE_CASH_BUFFER, CASH_BUFFER,
            cap(config, Reaction.USE_CASH_BUFFER), agent.itemAmount(CASH_BUFFER));
        waterfall.step(Reaction.SELL_GILT, GILT_HOLDINGS,
            cap(config, Reaction.SELL_GILT), agent.itemAmount(GILT_HOLDINGS));
        waterfall.step(Reaction.SELL_CORP_BONDS, CORPORATE_BONDS,
            cap(config, Reaction.SELL_CORP_BONDS), agent.itemAmount(CORPORATE_BONDS));

        if (aum > 0 && cumulativeInflows / aum > config.getGateThreshold() && !waterfall.isExhausted()) {
            waterfall.step(Reaction.SWING_PRICING, null,
                cap(config, Reaction.SWING_PRICING), waterfall.getRemaining());
            gateActive = true;
        }
    }

    private static ReactionCap cap(EngineConfig config, Reaction reaction) {
        return config.getReactionCap(AgentType.FUND_COMPLEX, reaction);
    }

    public double getAum() {
        return aum;
    }

    public double getPensionInvestorShare() {
        return pensionInvestorShare;
    }

    public double getInsurerInvestorShare() {
        return insurerInvestorShare;
    }

    public double getCumulativeInflows() {
        return cumulativeInflows;
    }

    public boolean isGateActive() {
        return gateActive;
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private final String id;
        private double theta = 0.20;
        private double bufferUsability = 0.15;
        private double giltHoldings;
        private double corporateBonds;
        private double absHoldings;
        private double cash;
        private double pensionInvestorShare = 0.25;
        private double insurerInvestorShare = 0.15;

        public Builder(String id) {
            this.id = id;
        }

        public Builder theta(double theta) {
            this.theta = theta;
            return this;
        }

        public Builder bufferUsability(double u) {
            this.bufferUsability = u;
            return this;
        }

        public Builder giltHoldings(double amount) {
            this.giltHoldings = amount;
            return this;
        }

        public Builder corporateBonds(double amount) {
            this.corporateBonds = amount;
            return this;
        }

        public Builder absHoldings(double amount) {
            this.absHoldings = amount;
            return this;
        }

        public Builder cash(double amount) {
            this.cash = amount;
            return this;
        }

        public Builder investorShares(double pension, double insurer) {
            this.pensionInvestorShare = pension;
            this.insurerInvestorShare = insurer;
            return this;
        }

        public Agent build() {
            if (!Double.isFinite(pensionInvestorShare) || pensionInvestorShare < 0
                    || !Double.isFinite(insurerInvestorShare) || insurerInvestorShare < 0) {
                throw new IllegalArgumentException("Fund " + id + ": investor shares must be finite and >= 0");
            }
            FundComplexBehavior behavior = new FundComplexBehavior(this);

            List<BalanceSheetItem> items = new ArrayList<>();
            items.add(BalanceSheetItem.tradeable(GILT_HOLDINGS, giltHoldings,
                Map.of(MarketVariable.GILT_10Y_YIELD, -0.0005, MarketVariable.GILT_30Y_YIELD, -0.0006), true));
            items.add(BalanceSheetItem.tradeable(CORPORATE_BONDS, corporateBonds,
                Map.of(MarketVariable.IG_CORP_SPREAD, -0.0004, MarketVariable.HY_CORP_SPREAD, -0.0002), true));
            items.add(BalanceSheetItem.of(ABS_HOLDINGS, absHoldings, ItemCategory.ILLIQUID_ASSET,
                Map.of(MarketVariable.IG_CORP_SPREAD, -0.0002)));
            items.add(BalanceSheetItem.of(CASH_BUFFER, cash, ItemCategory.LIQUID_ASSET));
            return new Agent(id, theta, bufferUsability, behavior.aum, items, behavior);
        }
    }
}
