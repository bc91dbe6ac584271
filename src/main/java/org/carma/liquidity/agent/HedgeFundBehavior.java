package org.carma.liquidity.agent;

import org.carma.liquidity.config.EngineConfig;
import org.carma.liquidity.config.ReactionCap;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.BalanceSheetItem;
import org.carma.liquidity.model.HedgeFundStrategy;
import org.carma.liquidity.model.ItemCategory;
import org.carma.liquidity.model.MarketVariable;
import org.carma.liquidity.model.Reaction;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Hedge fund: leveraged, repo funded, strategy driven.
 *
 * <p>Buffer is unencumbered cash (10% of AUM), floored at 0.5% of AUM. Losses
 * are marked on assets only and scaled up by leverage.
 *
 * <p>Waterfall: repo from connected banks, then strategy specific sales, then
 * redemptions from the fund complexes it invests in.
 */
public final class HedgeFundBehavior implements AgentBehavior {

    public static final String GILT_POSITIONS = "Gilt Positions (net)";
    public static final String EQUITY_POSITIONS = "Equity Positions";
    public static final String CORP_BOND_POSITIONS = "Corp Bond Positions";
    public static final String BASIS_TRADE_POSITIONS = "Basis Trade Positions";
    public static final String CASH_AND_MARGIN = "Cash & Margin";
    public static final String REPO_BORROWING = "Repo Borrowing";
    public static final String MARGIN_POSTED = "Margin Posted";

    private static final double CASH_PCT_OF_AUM = 0.10;
    private static final double MARGIN_POSTED_PCT_OF_AUM = 0.08;
    private static final double FLOOR_PCT_OF_AUM = 0.005;
    private static final double MIN_REPO_ASK_DEPENDENCE = 0.6;

    private final HedgeFundStrategy strategy;
    private final double aum;
    private final double leverage;
    private final double varUtilisation;
    private final RepoFunding repoFunding = new RepoFunding();

    private HedgeFundBehavior(Builder builder) {
        this.strategy = builder.strategy;
        this.aum = builder.aum;
        this.leverage = builder.leverage;
        this.varUtilisation = builder.varUtilisation;
    }

    @Override
    public AgentType type() {
        return AgentType.HEDGE_FUND;
    }

    // ========================================================================
    // Stage 1
    // ========================================================================

    @Override
    public double weightedBuffer(Agent agent) {
        return agent.itemAmount(CASH_AND_MARGIN);
    }

    @Override
    public double bufferFloor(Agent agent) {
        return aum * FLOOR_PCT_OF_AUM;
    }

    @Override
    public boolean marksToMarket(BalanceSheetItem item) {
        return item.getCategory().isAsset();
    }

    @Override
    public double scaleMarkToMarket(Agent agent, double rawLoss) {
        return rawLoss * (1.0 + (leverage - 1.0) * 0.3);
    }

    @Override
    public double marginCalls(Agent agent, StepContext ctx) {
        double largestMove = 0.0;
        for (MarketVariable v : strategy.getPrimarySensitivities()) {
            largestMove = Math.max(largestMove, Math.abs(ctx.market().level(v)));
        }
        double exposure = aum * leverage;
        double vm = exposure * largestMove * 1e-4 * 0.022;
        double im = exposure * Math.max(0.0, ctx.market().volatilityRatio() - 1.0) * 0.002;

        double dependence = getRepoDependence();
        double haircut = 0.0;
        if (dependence > 0.5) {
            haircut = aum * dependence * Math.max(0.0, ctx.market().level(MarketVariable.REPO_HAIRCUT_GILT)) * 0.003;
        }
        return vm + im + haircut;
    }

    /**
     * LP redemptions when volatility is high and the risk budget is nearly used.
     */
    @Override
    public double ownOutflows(Agent agent, StepContext ctx) {
        if (ctx.market().volatilityRatio() > 2.5 && varUtilisation > 0.85) {
            return aum * 0.02;
        }
        return 0.0;
    }

    // ========================================================================
    // Stage 2
    // ========================================================================

    @Override
    public void buildWaterfall(Agent agent, StepContext ctx, Waterfall waterfall) {
        EngineConfig config = ctx.config();

        // Repo first: only connected banks are asked
        ReactionCap repoCap = config.getReactionCap(AgentType.HEDGE_FUND, Reaction.SEEK_REPO);
        double askShare = Math.min(1.0, repoCap.share() * Math.max(getRepoDependence(), MIN_REPO_ASK_DEPENDENCE));
        double ask = waterfall.getRemaining() * askShare;
        double obtained = repoFunding.request(agent, ask, ctx);
        if (obtained > 0) {
            waterfall.step(Reaction.SEEK_REPO, null, askShare, obtained);
        }

        switch (strategy) {
            case RELATIVE_VALUE -> {
                sell(agent, config, waterfall, Reaction.SELL_GILT_BASIS_UNWIND, BASIS_TRADE_POSITIONS);
                sell(agent, config, waterfall, Reaction.SELL_GILT, GILT_POSITIONS);
            }
            case MACRO_RATES -> sell(agent, config, waterfall, Reaction.SELL_GILT, GILT_POSITIONS);
            case CREDIT_LONG_SHORT -> sell(agent, config, waterfall, Reaction.SELL_CORP_BONDS, CORP_BOND_POSITIONS);
            case LONG_SHORT_EQUITY -> sell(agent, config, waterfall, Reaction.SELL_EQUITY, EQUITY_POSITIONS);
            case MULTI_STRATEGY -> {
                ReactionCap cap = config.getMultiStrategyCap();
                waterfall.step(Reaction.SELL_GILT, GILT_POSITIONS, cap, agent.itemAmount(GILT_POSITIONS));
                waterfall.step(Reaction.SELL_CORP_BONDS, CORP_BOND_POSITIONS, cap, agent.itemAmount(CORP_BOND_POSITIONS));
                waterfall.step(Reaction.SELL_EQUITY, EQUITY_POSITIONS, cap, agent.itemAmount(EQUITY_POSITIONS));
            }
            default -> throw new IllegalStateException("Unhandled strategy: " + strategy);
        }

        if (!ctx.network().redemptionTargets(agent.getId()).isEmpty()) {
            waterfall.step(Reaction.REDEEM_FUND, null,
                config.getReactionCap(AgentType.HEDGE_FUND, Reaction.REDEEM_FUND), aum);
        }
    }

    private static void sell(Agent agent, EngineConfig config, Waterfall waterfall,
                             Reaction reaction, String item) {
        waterfall.step(reaction, item, config.getReactionCap(AgentType.HEDGE_FUND, reaction),
            agent.itemAmount(item));
    }

    @Override
    public Optional<RepoFunding> repoFunding() {
        return Optional.of(repoFunding);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public HedgeFundStrategy getStrategy() {
        return strategy;
    }

    public double getAum() {
        return aum;
    }

    public double getLeverage() {
        return leverage;
    }

    public double getVarUtilisation() {
        return varUtilisation;
    }

    public double getRepoDependence() {
        return strategy.getRepoDependence().getWeight();
    }

    public RepoFunding getRepoFunding() {
        return repoFunding;
    }

    // ========================================================================
    // Builder
    // ========================================================================

    /**
     * Builds a hedge fund agent. Positions are derived from AUM, leverage and
     * the strategy's exposure split.
     */
    public static class Builder {
        private final String id;
        private final HedgeFundStrategy strategy;
        private double theta = 0.25;
        private double bufferUsability = 0.2;
        private double aum;
        private double leverage;
        private double varUtilisation = 0.7;

        public Builder(String id, HedgeFundStrategy strategy) {
            this.id = id;
            this.strategy = Objects.requireNonNull(strategy, "strategy");
            this.leverage = strategy.getMinLeverage();
        }

        public Builder theta(double theta) {
            this.theta = theta;
            return this;
        }

        public Builder bufferUsability(double u) {
            this.bufferUsability = u;
            return this;
        }

        public Builder aum(double aum) {
            this.aum = aum;
            return this;
        }

        public Builder leverage(double leverage) {
            this.leverage = leverage;
            return this;
        }

        public Builder varUtilisation(double utilisation) {
            this.varUtilisation = utilisation;
            return this;
        }

        public Agent build() {
            if (!Double.isFinite(aum) || aum < 0) {
                throw new IllegalArgumentException("Hedge fund " + id + ": AUM must be finite and >= 0: " + aum);
            }
            if (!Double.isFinite(leverage) || leverage < 1.0) {
                throw new IllegalArgumentException("Hedge fund " + id + ": leverage must be finite and >= 1: " + leverage);
            }
            double gross = aum * leverage;
            double dependence = strategy.getRepoDependence().getWeight();

            List<BalanceSheetItem> items = new ArrayList<>();
            items.add(BalanceSheetItem.tradeable(GILT_POSITIONS, gross * strategy.getGiltShare(),
                giltSensitivities(), true));
            items.add(BalanceSheetItem.tradeable(EQUITY_POSITIONS, gross * strategy.getEquityShare(),
                Map.of(MarketVariable.EQUITY, equitySensitivity()), false));
            items.add(BalanceSheetItem.tradeable(CORP_BOND_POSITIONS, gross * strategy.getCorpShare(),
                corpSensitivities(), true));
            items.add(BalanceSheetItem.tradeable(BASIS_TRADE_POSITIONS, gross * strategy.getBasisShare(),
                Map.of(MarketVariable.BOND_FUTURES_BASIS, -0.001, MarketVariable.GILT_10Y_YIELD, -0.0003), true));
            items.add(BalanceSheetItem.of(CASH_AND_MARGIN, aum * CASH_PCT_OF_AUM, ItemCategory.LIQUID_ASSET));
            items.add(BalanceSheetItem.of(REPO_BORROWING, gross * dependence * 0.3, ItemCategory.LIABILITY));
            items.add(BalanceSheetItem.of(MARGIN_POSTED, aum * MARGIN_POSTED_PCT_OF_AUM, ItemCategory.ILLIQUID_ASSET));
            return new Agent(id, theta, bufferUsability, aum, items, new HedgeFundBehavior(this));
        }

        private Map<MarketVariable, Double> giltSensitivities() {
            Map<MarketVariable, Double> sens = new EnumMap<>(MarketVariable.class);
            if (strategy.isPrimary(MarketVariable.GILT_10Y_YIELD)) {
                sens.put(MarketVariable.GILT_10Y_YIELD, -0.0006);
            } else if (strategy.isSecondary(MarketVariable.GILT_10Y_YIELD)) {
                sens.put(MarketVariable.GILT_10Y_YIELD, -0.0002);
            }
            if (strategy.isPrimary(MarketVariable.GILT_30Y_YIELD)) {
                sens.put(MarketVariable.GILT_30Y_YIELD, -0.0008);
            }
            if (strategy.isPrimary(MarketVariable.SONIA_SWAP)) {
                sens.put(MarketVariable.SONIA_SWAP, -0.0003);
            }
            if (sens.isEmpty()) {
                sens.put(MarketVariable.GILT_10Y_YIELD, -0.0002);
            }
            return sens;
        }

        private double equitySensitivity() {
            if (strategy.isPrimary(MarketVariable.EQUITY)) return 0.012;
            if (strategy.isSecondary(MarketVariable.EQUITY)) return 0.005;
            return 0.002;
        }

        private Map<MarketVariable, Double> corpSensitivities() {
            Map<MarketVariable, Double> sens = new EnumMap<>(MarketVariable.class);
            if (strategy.isPrimary(MarketVariable.IG_CORP_SPREAD)) {
                sens.put(MarketVariable.IG_CORP_SPREAD, -0.0005);
            }
            if (strategy.isPrimary(MarketVariable.HY_CORP_SPREAD)) {
                sens.put(MarketVariable.HY_CORP_SPREAD, -0.0003);
            }
            if (sens.isEmpty()) {
                sens.put(MarketVariable.IG_CORP_SPREAD, -0.0002);
            }
            return sens;
        }
    }
}
