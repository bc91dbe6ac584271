package org.carma.liquidity.agent;

import org.carma.liquidity.config.EngineConfig;
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
 * Bank: intermediary, repo provider and market maker.
 *
 * <p>Buffer: 0.15 × central-bank-eligible collateral + 0.08 × CET1 headroom
 * − 0.10 × wholesale funding, floored at 0.2% of the balance sheet.
 *
 * <p>Waterfall: draw on the central bank facility, cut repo lending, sell gilts,
 * sell corporate bonds.
 *
 * <p>Besides its own stages the bank answers repo requests from connected
 * non-banks and absorbs selling through its {@link MarketMakingCapacity}.
 * A bank that reacts permanently tightens its willingness to extend repo.
 */
public final class BankBehavior implements AgentBehavior {

    public static final String GILT_HOLDINGS = "Gilt Holdings";
    public static final String CORPORATE_BONDS = "Corporate Bond Holdings";
    public static final String EQUITY_PORTFOLIO = "Equity Portfolio";
    public static final String REPO_LENDING = "Repo Lending";
    public static final String DERIVATIVE_ASSETS = "Derivative Assets";
    public static final String CENTRAL_BANK_ELIGIBLE = "BoE Facility Eligible";
    public static final String WHOLESALE_FUNDING = "Wholesale Funding";
    public static final String CET1_BUFFER = "CET1 Buffer";

    private static final double ELIGIBLE_WEIGHT = 0.15;
    private static final double CET1_WEIGHT = 0.08;
    private static final double WHOLESALE_RUNOFF_WEIGHT = 0.10;
    private static final double FLOOR_PCT_OF_BALANCE_SHEET = 0.002;

    private final double totalBalanceSheet;
    private final double riskAppetite;
    private final double repoCapacity;
    private double willingnessToExtendNew;
    private double willingnessToRoll;
    private final MarketMakingCapacity marketMaking;

    private BankBehavior(Builder builder) {
        this.totalBalanceSheet = builder.totalBalanceSheet;
        this.riskAppetite = builder.riskAppetite;
        this.repoCapacity = builder.repoCapacity;
        this.willingnessToExtendNew = builder.willingnessToExtendNew;
        this.willingnessToRoll = builder.willingnessToRoll;
        this.marketMaking = MarketMakingCapacity.of(builder.giltMarketMaking, builder.corpMarketMaking);
    }

    @Override
    public AgentType type() {
        return AgentType.BANK;
    }

    // ========================================================================
    // Stage 1
    // ========================================================================

    @Override
    public double weightedBuffer(Agent agent) {
        return agent.itemAmount(CENTRAL_BANK_ELIGIBLE) * ELIGIBLE_WEIGHT
            + agent.itemAmount(CET1_BUFFER) * CET1_WEIGHT
            - agent.itemAmount(WHOLESALE_FUNDING) * WHOLESALE_RUNOFF_WEIGHT;
    }

    @Override
    public double bufferFloor(Agent agent) {
        return totalBalanceSheet * FLOOR_PCT_OF_BALANCE_SHEET;
    }

    @Override
    public double marginCalls(Agent agent, StepContext ctx) {
        double deriv = agent.itemAmount(DERIVATIVE_ASSETS);
        if (deriv <= 0) return 0.0;
        double stress = ctx.market().volatilityRatio();
        double vm = deriv * Math.abs(ctx.market().level(MarketVariable.GILT_10Y_YIELD)) * 1e-4 * 0.05;
        double im = stress > 1.0 ? deriv * (stress - 1.0) * 0.005 : 0.0;
        return vm + im;
    }

    /**
     * Wholesale funding run-off once volatility is more than twice its baseline.
     */
    @Override
    public double ownOutflows(Agent agent, StepContext ctx) {
        double stress = ctx.market().volatilityRatio();
        if (stress <= 2.0) return 0.0;
        return agent.itemAmount(WHOLESALE_FUNDING) * (stress - 2.0) * 0.02;
    }

    // ========================================================================
    // Stage 2
    // ========================================================================

    @Override
    public void buildWaterfall(Agent agent, StepContext ctx, Waterfall waterfall) {
        EngineConfig config = ctx.config();

        waterfall.step(Reaction.DRAW_CENTRAL_BANK_FACILITY, CENTRAL_BANK_ELIGIBLE,
            config.getReactionCap(AgentType.BANK, Reaction.DRAW_CENTRAL_BANK_FACILITY),
            agent.itemAmount(CENTRAL_BANK_ELIGIBLE));

        waterfall.step(Reaction.REDUCE_REPO_LENDING, REPO_LENDING,
            config.getReactionCap(AgentType.BANK, Reaction.REDUCE_REPO_LENDING),
            agent.itemAmount(REPO_LENDING) * (1.0 - riskAppetite));

        waterfall.step(Reaction.SELL_GILT, GILT_HOLDINGS,
            config.getReactionCap(AgentType.BANK, Reaction.SELL_GILT),
            agent.itemAmount(GILT_HOLDINGS));

        waterfall.step(Reaction.SELL_CORP_BONDS, CORPORATE_BONDS,
            config.getReactionCap(AgentType.BANK, Reaction.SELL_CORP_BONDS),
            agent.itemAmount(CORPORATE_BONDS));
    }

    // ========================================================================
    // Repo Provision
    // ========================================================================

    /**
     * Amount of new repo this bank will extend to a requester.
     *
     * Zero unless the requester is linked to the bank by a bank edge. Otherwise
     * willingness decays linearly from full at no stress to nothing at the
     * configured refusal stress ratio.
     *
     * @param bank        the agent owning this behaviour
     * @param requesterId the non-bank asking for repo
     * @param ask         amount requested from this bank
     */
    public double assessRepoRequest(Agent bank, String requesterId, double ask, StepContext ctx) {
        if (!Double.isFinite(ask) || ask < 0) {
            throw new IllegalStateException("Repo ask must be finite and >= 0: " + ask);
        }
        if (ask == 0 || !ctx.network().isConnectedToBank(requesterId, bank.getId())) {
            return 0.0;
        }
        double threshold = ctx.config().getBankRepoRefusalStressThreshold();
        double stressRatio = bank.getLiquidity().stressRatio();
        double stressScaling = Math.max(0.0, 1.0 - stressRatio / threshold);
        double available = repoCapacity * willingnessToExtendNew * riskAppetite * stressScaling;
        return Math.min(ask, available);
    }

    /**
     * Permanent tightening applied after registration on a day the bank reacted.
     */
    public void tightenRepo() {
        double tightening = (1.0 - riskAppetite) * 0.3;
        willingnessToExtendNew = Math.max(0.0, willingnessToExtendNew - tightening);
        willingnessToRoll = Math.max(0.5, willingnessToRoll - tightening * 0.5);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public double getTotalBalanceSheet() {
        return totalBalanceSheet;
    }

    public double getRiskAppetite() {
        return riskAppetite;
    }

    public double getRepoCapacity() {
        return repoCapacity;
    }

    public double getWillingnessToExtendNew() {
        return willingnessToExtendNew;
    }

    public double getWillingnessToRoll() {
        return willingnessToRoll;
    }

    public MarketMakingCapacity getMarketMaking() {
        return marketMaking;
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private final String id;
        private double theta = 0.40;
        private double bufferUsability = 0.5;
        private double totalBalanceSheet;
        private double giltHoldings;
        private double corporateBonds;
        private double equityPortfolio;
        private double repoLending;
        private double derivativeAssets;
        private double centralBankEligible;
        private double wholesaleFunding;
        private double cet1Buffer;
        private double riskAppetite = 0.5;
        private double repoCapacity;
        private double willingnessToExtendNew = 0.7;
        private double willingnessToRoll = 0.8;
        private double giltMarketMaking;
        private double corpMarketMaking;

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

        public Builder totalBalanceSheet(double amount) {
            this.totalBalanceSheet = amount;
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

        public Builder equityPortfolio(double amount) {
            this.equityPortfolio = amount;
            return this;
        }

        public Builder repoLending(double amount) {
            this.repoLending = amount;
            return this;
        }

        public Builder derivativeAssets(double amount) {
            this.derivativeAssets = amount;
            return this;
        }

        public Builder centralBankEligible(double amount) {
            this.centralBankEligible = amount;
            return this;
        }

        public Builder wholesaleFunding(double amount) {
            this.wholesaleFunding = amount;
            return this;
        }

        public Builder cet1Buffer(double amount) {
            this.cet1Buffer = amount;
            return this;
        }

        public Builder riskAppetite(double appetite) {
            if (!Double.isFinite(appetite) || appetite < 0 || appetite > 1) {
                throw new IllegalArgumentException("Risk appetite must be in [0, 1]: " + appetite);
            }
            this.riskAppetite = appetite;
            return this;
        }

        public Builder repoCapacity(double amount) {
            this.repoCapacity = amount;
            return this;
        }

        public Builder repoWillingness(double extendNew, double roll) {
            this.willingnessToExtendNew = extendNew;
            this.willingnessToRoll = roll;
            return this;
        }

        public Builder marketMakingCapacity(double gilt, double corporate) {
            this.giltMarketMaking = gilt;
            this.corpMarketMaking = corporate;
            return this;
        }

        public Agent build() {
            if (!Double.isFinite(totalBalanceSheet) || totalBalanceSheet < 0) {
                throw new IllegalArgumentException("Bank " + id + ": balance sheet must be finite and >= 0");
            }
            if (!Double.isFinite(repoCapacity) || repoCapacity < 0) {
                throw new IllegalArgumentException("Bank " + id + ": repo capacity must be finite and >= 0");
            }
            List<BalanceSheetItem> items = new ArrayList<>();
            items.add(BalanceSheetItem.tradeable(GILT_HOLDINGS, giltHoldings,
                Map.of(MarketVariable.GILT_10Y_YIELD, -0.00045, MarketVariable.GILT_30Y_YIELD, -0.00065), true));
            items.add(BalanceSheetItem.tradeable(CORPORATE_BONDS, corporateBonds,
                Map.of(MarketVariable.IG_CORP_SPREAD, -0.0004, MarketVariable.HY_CORP_SPREAD, -0.0002), true));
            items.add(BalanceSheetItem.tradeable(EQUITY_PORTFOLIO, equityPortfolio,
                Map.of(MarketVariable.EQUITY, 0.01), false));
            items.add(BalanceSheetItem.of(REPO_LENDING, repoLending, ItemCategory.LIQUID_ASSET));
            items.add(BalanceSheetItem.of(DERIVATIVE_ASSETS, derivativeAssets, ItemCategory.ILLIQUID_ASSET,
                Map.of(MarketVariable.GILT_10Y_YIELD, -0.0002, MarketVariable.SONIA_SWAP, -0.0002)));
            items.add(new BalanceSheetItem(CENTRAL_BANK_ELIGIBLE, centralBankEligible, ItemCategory.LIQUID_ASSET,
                Map.of(), true, false, 0.0));
            items.add(BalanceSheetItem.of(WHOLESALE_FUNDING, wholesaleFunding, ItemCategory.LIABILITY));
            items.add(BalanceSheetItem.of(CET1_BUFFER, cet1Buffer, ItemCategory.EQUITY));
            return new Agent(id, theta, bufferUsability, totalBalanceSheet, items, new BankBehavior(this));
        }
    }
}
