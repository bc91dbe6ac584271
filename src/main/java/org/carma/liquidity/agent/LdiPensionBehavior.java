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
import java.util.Optional;

/**
 * LDI / pension fund: leveraged liability hedging through gilts and swaps.
 *
 * <p>Collateral calls on the derivative overlay are the main loss channel.
 * Once gilt yields have moved past the yield buffer the calls escalate.
 *
 * <p>Waterfall: post unencumbered collateral, sponsor recapitalisation, sell
 * gilts, IL gilts and corporate bonds, repo from clearing banks, redeem money
 * market fund holdings. Pooled funds recapitalise within a day; segregated
 * mandates wait for trustee sign-off and spread the capital call over several
 * days.
 */
public final class LdiPensionBehavior implements AgentBehavior {

    public static final String GILT_HOLDINGS = "Gilt Holdings";
    public static final String IL_GILT_HOLDINGS = "IL Gilt Holdings";
    public static final String CORPORATE_BONDS = "Corporate Bond Holdings";
    public static final String CASH_AND_MMF = "Cash & MMF";
    public static final String DERIVATIVES_EXPOSURE = "Derivatives Exposure";
    public static final String UNENCUMBERED_COLLATERAL = "Unencumbered Collateral";
    public static final String MARGIN_POSTED = "Margin Posted";

    private static final double COLLATERAL_WEIGHT = 0.3;
    private static final double FLOOR_PCT_OF_AUM = 0.005;

    private final double aum;
    private final double leverage;
    private final double yieldBufferBps;
    private final boolean pooled;
    private final double recapAvailable;
    private final int recapSpeedDays;
    private final int trusteeLagDays;
    private final RepoFunding repoFunding = new RepoFunding();

    private int stressedDays;
    private double recapUsed;

    private LdiPensionBehavior(Builder builder) {
        this.aum = builder.giltHoldings + builder.ilGiltHoldings + builder.corporateBonds + builder.cash;
        this.leverage = builder.leverage;
        this.yieldBufferBps = builder.yieldBufferBps;
        this.pooled = builder.pooled;
        this.recapAvailable = builder.recapAvailable;
        this.recapSpeedDays = builder.pooled ? 1 : builder.recapSpeedDays;
        this.trusteeLagDays = builder.pooled ? 0 : builder.trusteeLagDays;
    }

    @Override
    public AgentType type() {
        return AgentType.LDI_PENSION;
    }

    // ========================================================================
    // Stage 1
    // ========================================================================

    @Override
    public double weightedBuffer(Agent agent) {
        return agent.itemAmount(CASH_AND_MMF) + agent.itemAmount(UNENCUMBERED_COLLATERAL) * COLLATERAL_WEIGHT;
    }

    @Override
    public double bufferFloor(Agent agent) {
        return aum * FLOOR_PCT_OF_AUM;
    }

    @Override
    public double scaleMarkToMarket(Agent agent, double rawLoss) {
        return rawLoss * leverage * 0.5;
    }

    @Override
    public double marginCalls(Agent agent, StepContext ctx) {
        double deriv = agent.itemAmount(DERIVATIVES_EXPOSURE);
        if (deriv <= 0) return 0.0;
        double g10 = Math.abs(ctx.market().level(MarketVariable.GILT_10Y_YIELD));
        double g30 = Math.abs(ctx.market().level(MarketVariable.GILT_30Y_YIELD));

        double vm = deriv * Math.max(g10, g30) * 1e-4 * 0.04;
        double im = deriv * Math.max(0.0, ctx.market().volatilityRatio() - 1.0) * 0.003;
        double escalation = 0.0;
        if (g10 >= yieldBufferBps) {
            escalation = deriv * (g10 - yieldBufferBps) * 1e-4 * 0.06;
        }
        return vm + im + escalation;
    }

    @Override
    public double ownOutflows(Agent agent, StepContext ctx) {
        return 0.0;
    }

    // ========================================================================
    // Stage 2
    // ========================================================================

    @Override
    public void buildWaterfall(Agent agent, StepContext ctx, Waterfall waterfall) {
        EngineConfig config = ctx.config();
        stressedDays++;

        waterfall.step(Reaction.POST_COLLATERAL, UNENCUMBERED_COLLATERAL,
            cap(config, Reaction.POST_COLLATERAL), agent.itemAmount(UNENCUMBERED_COLLATERAL));

        if (isRecapitalisationAvailable()) {
            double perDay = Math.max(0.0, recapAvailable - recapUsed) / recapSpeedDays;
            recapUsed += waterfall.step(Reaction.RECAPITALISATION, null,
                cap(config, Reaction.RECAPITALISATION), perDay);
        }

        waterfall.step(Reaction.SELL_GILT, GILT_HOLDINGS,
            cap(config, Reaction.SELL_GILT), agent.itemAmount(GILT_HOLDINGS));
        waterfall.step(Reaction.SELL_IL_GILT, IL_GILT_HOLDINGS,
            cap(config, Reaction.SELL_IL_GILT), agent.itemAmount(IL_GILT_HOLDINGS));
        waterfall.step(Reaction.SELL_CORP_BONDS, CORPORATE_BONDS,
            cap(config, Reaction.SELL_CORP_BONDS), agent.itemAmount(CORPORATE_BONDS));

        double askShare = cap(config, Reaction.SEEK_REPO).share();
        double obtained = repoFunding.request(agent, waterfall.getRemaining() * askShare, ctx);
        if (obtained > 0) {
            waterfall.step(Reaction.SEEK_REPO, null, askShare, obtained);
        }

        if (!ctx.network().redemptionTargets(agent.getId()).isEmpty()) {
            waterfall.step(Reaction.REDEEM_FUND, null, cap(config, Reaction.REDEEM_FUND), aum);
        }
    }

    private static ReactionCap cap(EngineConfig config, Reaction reaction) {
        return config.getReactionCap(AgentType.LDI_PENSION, reaction);
    }

    /**
     * Pooled funds can call capital at once; segregated mandates only from
     * their trustee-lag-th stressed day.
     */
    public boolean isRecapitalisationAvailable() {
        return pooled || stressedDays >= trusteeLagDays;
    }

    @Override
    public Optional<RepoFunding> repoFunding() {
        return Optional.of(repoFunding);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public double getAum() {
        return aum;
    }

    public double getLeverage() {
        return leverage;
    }

    public double getYieldBufferBps() {
        return yieldBufferBps;
    }

    public boolean isPooled() {
        return pooled;
    }

    public double getRecapAvailable() {
        return recapAvailable;
    }

    public double getRecapUsed() {
        return recapUsed;
    }

    public int getRecapSpeedDays() {
        return recapSpeedDays;
    }

    public int getTrusteeLagDays() {
        return trusteeLagDays;
    }

    public int getStressedDays() {
        return stressedDays;
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private final String id;
        private double theta = 0.30;
        private double bufferUsability = 0.3;
        private double giltHoldings;
        private double ilGiltHoldings;
        private double corporateBonds;
        private double cash;
        private double derivativesExposure;
        private double unencumberedCollateral;
        private double leverage = 3.0;
        private double yieldBufferBps = 150.0;
        private boolean pooled = true;
        private double recapAvailable;
        private int recapSpeedDays = 3;
        private int trusteeLagDays = 2;

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

        public Builder ilGiltHoldings(double amount) {
            this.ilGiltHoldings = amount;
            return this;
        }

        public Builder corporateBonds(double amount) {
            this.corporateBonds = amount;
            return this;
        }

        public Builder cash(double amount) {
            this.cash = amount;
            return this;
        }

        public Builder derivativesExposure(double amount) {
            this.derivativesExposure = amount;
            return this;
        }

        public Builder unencumberedCollateral(double amount) {
            this.unencumberedCollateral = amount;
            return this;
        }

        public Builder leverage(double leverage) {
            this.leverage = leverage;
            return this;
        }

        public Builder yieldBufferBps(double bps) {
            this.yieldBufferBps = bps;
            return this;
        }

        public Builder pooled(boolean pooled) {
            this.pooled = pooled;
            return this;
        }

        public Builder recapitalisation(double available, int speedDays, int trusteeLagDays) {
            this.recapAvailable = available;
            this.recapSpeedDays = speedDays;
            this.trusteeLagDays = trusteeLagDays;
            return this;
        }

        public Agent build() {
            if (!Double.isFinite(leverage) || leverage <= 0) {
                throw new IllegalArgumentException("LDI " + id + ": leverage must be finite and > 0: " + leverage);
            }
            if (!Double.isFinite(yieldBufferBps) || yieldBufferBps < 0) {
                throw new IllegalArgumentException("LDI " + id + ": yield buffer must be finite and >= 0: " + yieldBufferBps);
            }
            if (!Double.isFinite(recapAvailable) || recapAvailable < 0) {
                throw new IllegalArgumentException("LDI " + id + ": recapitalisation must be finite and >= 0: " + recapAvailable);
            }
            if (recapSpeedDays < 1 || trusteeLagDays < 0) {
                throw new IllegalArgumentException("LDI " + id + ": recap speed must be >= 1 and trustee lag >= 0");
            }
            LdiPensionBehavior behavior = new LdiPensionBehavior(this);

            List<BalanceSheetItem> items = new ArrayList<>();
            items.add(BalanceSheetItem.tradeable(GILT_HOLDINGS, giltHoldings,
                Map.of(MarketVariable.GILT_10Y_YIELD, -0.0006, MarketVariable.GILT_30Y_YIELD, -0.0009), true));
            items.add(BalanceSheetItem.tradeable(IL_GILT_HOLDINGS, ilGiltHoldings,
                Map.of(MarketVariable.IL_GILT_YIELD, -0.0007), true));
            items.add(BalanceSheetItem.tradeable(CORPORATE_BONDS, corporateBonds,
                Map.of(MarketVariable.IG_CORP_SPREAD, -0.0004), true));
            items.add(BalanceSheetItem.of(CASH_AND_MMF, cash, ItemCategory.LIQUID_ASSET));
            items.add(BalanceSheetItem.of(DERIVATIVES_EXPOSURE, derivativesExposure, ItemCategory.OFF_BALANCE_SHEET,
                Map.of(MarketVariable.GILT_10Y_YIELD, -0.0003, MarketVariable.SONIA_SWAP, -0.0003,
                    MarketVariable.GILT_30Y_YIELD, -0.0004)));
            items.add(new BalanceSheetItem(UNENCUMBERED_COLLATERAL, unencumberedCollateral, ItemCategory.LIQUID_ASSET,
                Map.of(), true, true, 0.0));
            items.add(BalanceSheetItem.of(MARGIN_POSTED, behavior.aum * 0.05, ItemCategory.ILLIQUID_ASSET));
            return new Agent(id, theta, bufferUsability, behavior.aum, items, behavior);
        }
    }
}
