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
 * Insurer: large, mostly hedged balance sheet with committed liquidity lines.
 *
 * Mark-to-market losses are offset by the hedge ratio. Variation margin is
 * small; a dirty CSA adds a surcharge when corporate collateral haircuts rise.
 * The waterfall draws committed lines before selling anything.
 */
public final class InsurerBehavior implements AgentBehavior {

    public static final String GILT_HOLDINGS = "Gilt Holdings";
    public static final String CORPORATE_BONDS = "Corporate Bond Holdings";
    public static final String EQUITY_PORTFOLIO = "Equity Portfolio";
    public static final String DERIVATIVE_HEDGES = "Derivative Hedges";
    public static final String CASH_AND_LIQUID = "Cash & Liquid";
    public static final String MARGIN_POSTED = "Margin Posted";
    public static final String COMMITTED_REPO_LINES = "Committed Repo Lines";
    public static final String RCF_AVAILABLE = "RCF Available";

    private static final double FLOOR_PCT_OF_ASSETS = 0.002;

    private final double totalAssets;
    private final double hedgeRatio;
    private final double dirtyCsaShare;
    private final RepoFunding repoFunding = new RepoFunding();

    private InsurerBehavior(Builder builder) {
        this.totalAssets = builder.giltHoldings + builder.corporateBonds + builder.equityPortfolio + builder.cash;
        this.hedgeRatio = builder.hedgeRatio;
        this.dirtyCsaShare = builder.dirtyCsaShare;
    }

    @Override
    public AgentType type() {
        return AgentType.INSURER;
    }

    @Override
    public double weightedBuffer(Agent agent) {
        return agent.itemAmount(CASH_AND_LIQUID) * 0.5
            + agent.itemAmount(COMMITTED_REPO_LINES) * 0.2
            + agent.itemAmount(RCF_AVAILABLE) * 0.2;
    }

    @Override
    public double bufferFloor(Agent agent) {
        return totalAssets * FLOOR_PCT_OF_ASSETS;
    }

    @Override
    public double scaleMarkToMarket(Agent agent, double rawLoss) {
        return rawLoss * (1.0 - hedgeRatio * 0.3);
    }

    @Override
    public double marginCalls(Agent agent, StepContext ctx) {
        double deriv = agent.itemAmount(DERIVATIVE_HEDGES);
        if (deriv <= 0) return 0.0;
        double vm = deriv * Math.abs(ctx.market().level(MarketVariable.GILT_10Y_YIELD)) * 1e-4 * 0.008;
        double im = deriv * Math.max(0.0, ctx.market().volatilityRatio() - 1.0) * 0.0008;
        double corpHaircut = Math.max(0.0, ctx.market().level(MarketVariable.REPO_HAIRCUT_CORP));
        double dirtyCsa = deriv * dirtyCsaShare * corpHaircut * 0.01 * 0.05;
        return vm + im + dirtyCsa;
    }

    /**
     * Policy surrenders once volatility exceeds 2.5 times its baseline.
     */
    @Override
    public double ownOutflows(Agent agent, StepContext ctx) {
        return ctx.market().volatilityRatio() > 2.5 ? totalAssets * 0.005 : 0.0;
    }

    @Override
    public void buildWaterfall(Agent agent, StepContext ctx, Waterfall waterfall) {
        EngineConfig config = ctx.config();

        waterfall.step(Reaction.DRAW_REPO_LINE, COMMITTED_REPO_LINES,
            cap(config, Reaction.DRAW_REPO_LINE), agent.itemAmount(COMMITTED_REPO_LINES));
        waterfall.step(Reaction.DRAW_CREDIT_FACILITY, RCF_AVAILABLE,
            cap(config, Reaction.DRAW_CREDIT_FACILITY), agent.itemAmount(RCF_AVAILABLE));
        waterfall.step(Reaction.SELL_GILT, GILT_HOLDINGS,
            cap(config, Reaction.SELL_GILT), agent.itemAmount(GILT_HOLDINGS));
        waterfall.step(Reaction.SELL_CORP_BONDS, CORPORATE_BONDS,
            cap(config, Reaction.SELL_CORP_BONDS), agent.itemAmount(CORPORATE_BONDS));
        waterfall.step(Reaction.SELL_EQUITY, EQUITY_PORTFOLIO,
            cap(config, Reaction.SELL_EQUITY), agent.itemAmount(EQUITY_PORTFOLIO));

        double askShare = cap(config, Reaction.SEEK_REPO).share();
        double obtained = repoFunding.request(agent, waterfall.getRemaining() * askShare, ctx);
        if (obtained > 0) {
            waterfall.step(Reaction.SEEK_REPO, null, askShare, obtained);
        }

        if (!ctx.network().redemptionTargets(agent.getId()).isEmpty()) {
            waterfall.step(Reaction.REDEEM_FUND, null, cap(config, Reaction.REDEEM_FUND), totalAssets);
        }
    }

    private static ReactionCap cap(EngineConfig config, Reaction reaction) {
        return config.getReactionCap(AgentType.INSURER, reaction);
    }

    @Override
    public Optional<RepoFunding> repoFunding() {
        return Optional.of(repoFunding);
    }

    public double getTotalAssets() {
        return totalAssets;
    }

    public double getHedgeRatio() {
        return hedgeRatio;
    }

    public double getDirtyCsaShare() {
        return dirtyCsaShare;
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private final String id;
        private double theta = 0.45;
        private double bufferUsability = 0.5;
        private double giltHoldings;
        private double corporateBonds;
        private double equityPortfolio;
        private double derivativeHedges;
        private double cash;
        private double committedRepoLines;
        private double rcfAvailable;
        private double hedgeRatio = 0.8;
        private double dirtyCsaShare;

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

        public Builder equityPortfolio(double amount) {
            this.equityPortfolio = amount;
            return this;
        }

        public Builder derivativeHedges(double amount) {
            this.derivativeHedges = amount;
            return this;
        }

        public Builder cash(double amount) {
            this.cash = amount;
            return this;
        }

        public Builder committedRepoLines(double amount) {
            this.committedRepoLines = amount;
            return this;
        }

        public Builder rcfAvailable(double amount) {
            this.rcfAvailable = amount;
            return this;
        }

        public Builder hedgeRatio(double ratio) {
            this.hedgeRatio = ratio;
            return this;
        }

        public Builder dirtyCsaShare(double share) {
            this.dirtyCsaShare = share;
            return this;
        }

        public Agent build() {
            if (!Double.isFinite(hedgeRatio) || hedgeRatio < 0 || hedgeRatio > 1) {
                throw new IllegalArgumentException("Insurer " + id + ": hedge ratio must be in [0, 1]: " + hedgeRatio);
            }
            if (!Double.isFinite(dirtyCsaShare) || dirtyCsaShare < 0 || dirtyCsaShare > 1) {
                throw new IllegalArgumentException("Insurer " + id + ": dirty CSA share must be in [0, 1]: " + dirtyCsaShare);
            }
            InsurerBehavior behavior = new InsurerBehavior(this);

            List<BalanceSheetItem> items = new ArrayList<>();
            items.add(BalanceSheetItem.tradeable(GILT_HOLDINGS, giltHoldings,
                Map.of(MarketVariable.GILT_10Y_YIELD, -0.0005, MarketVariable.GILT_30Y_YIELD, -0.0007), true));
            items.add(BalanceSheetItem.tradeable(CORPORATE_BONDS, corporateBonds,
                Map.of(MarketVariable.IG_CORP_SPREAD, -0.0004, MarketVariable.HY_CORP_SPREAD, -0.0002), true));
            items.add(BalanceSheetItem.tradeable(EQUITY_PORTFOLIO, equityPortfolio,
                Map.of(MarketVariable.EQUITY, 0.01), false));
            items.add(BalanceSheetItem.of(DERIVATIVE_HEDGES, derivativeHedges, ItemCategory.OFF_BALANCE_SHEET,
                Map.of(MarketVariable.GILT_10Y_YIELD, -0.0002, MarketVariable.SONIA_SWAP, -0.0002)));
            items.add(BalanceSheetItem.of(CASH_AND_LIQUID, cash, ItemCategory.LIQUID_ASSET));
            items.add(BalanceSheetItem.of(MARGIN_POSTED, behavior.totalAssets * 0.02, ItemCategory.ILLIQUID_ASSET));
            items.add(BalanceSheetItem.of(COMMITTED_REPO_LINES, committedRepoLines, ItemCategory.OFF_BALANCE_SHEET));
            items.add(BalanceSheetItem.of(RCF_AVAILABLE, rcfAvailable, ItemCategory.OFF_BALANCE_SHEET));
            return new Agent(id, theta, bufferUsability, behavior.totalAssets, items, behavior);
        }
    }
}
