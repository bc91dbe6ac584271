package org.carma.liquidity.engine;

import org.carma.liquidity.agent.AgentBehavior;
import org.carma.liquidity.agent.StepContext;
import org.carma.liquidity.agent.Waterfall;
import org.carma.liquidity.config.EngineConfig;
import org.carma.liquidity.market.MarketState;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AssetClass;
import org.carma.liquidity.model.BalanceSheetItem;
import org.carma.liquidity.model.ExecutedAction;
import org.carma.liquidity.model.LiquidityPosition;
import org.carma.liquidity.model.MarketVariable;
import org.carma.liquidity.model.Reaction;

import java.util.Map;

/**
 * Three-stage liquidity mechanics shared by every agent variant.
 *
 * The variant {@link AgentBehavior} supplies buffer weights, loss channels and
 * the waterfall; everything else (flooring, thresholds, efficiencies,
 * registration, stage 3 and realized sales) is the same for all agents.
 */
public final class LiquidityMechanics {

    private LiquidityMechanics() {
    }

    // ========================================================================
    // Buffer
    // ========================================================================

    /**
     * Compute and store B0. Always strictly positive; the agent is flagged as
     * having a degenerate buffer when the weighted buffer had to be floored.
     */
    public static double computeInitialBuffer(Agent agent) {
        AgentBehavior behavior = agent.getBehavior();
        double weighted = behavior.weightedBuffer(agent);
        double floor = behavior.bufferFloor(agent);
        if (Double.isNaN(weighted) || Double.isNaN(floor)) {
            throw new IllegalStateException("Agent " + agent.getId() + ": buffer is NaN");
        }
        double b0 = Math.max(weighted, Math.max(floor, Agent.ABSOLUTE_BUFFER_FLOOR));
        agent.setDegenerateBuffer(b0 > weighted);
        agent.getLiquidity().startDay(b0);
        return b0;
    }

    // ========================================================================
    // Stage 1
    // ========================================================================

    /**
     * Mark-to-market loss: Σ |amount × sensitivity × dayDelta| over the items
     * the variant marks, then the variant's scaling.
     */
    public static double markToMarket(Agent agent, Map<MarketVariable, Double> dayDelta) {
        AgentBehavior behavior = agent.getBehavior();
        double raw = 0.0;
        for (BalanceSheetItem item : agent.getBalanceSheet()) {
            if (!behavior.marksToMarket(item)) continue;
            for (Map.Entry<MarketVariable, Double> s : item.getSensitivities().entrySet()) {
                double move = dayDelta.getOrDefault(s.getKey(), 0.0);
                raw += Math.abs(item.getAmount() * s.getValue() * move);
            }
        }
        return requireLoss(agent, "mark-to-market", behavior.scaleMarkToMarket(agent, raw));
    }

    /**
     * Direct losses: mark-to-market, margin calls and own outflows. Sets the
     * direct component of E1, E1 itself and B1.
     */
    public static double computeDirectLosses(Agent agent, StepContext ctx) {
        AgentBehavior behavior = agent.getBehavior();
        double mtm = markToMarket(agent, ctx.dayDelta());
        double margin = requireLoss(agent, "margin calls", behavior.marginCalls(agent, ctx));
        double outflows = requireLoss(agent, "own outflows", behavior.ownOutflows(agent, ctx));
        agent.addMarginCalls(margin);

        double direct = mtm + margin + outflows;
        LiquidityPosition pos = agent.getLiquidity();
        pos.setE1Direct(direct);
        pos.setE1(direct);
        pos.setB1(pos.getB0() - direct);
        return direct;
    }

    /**
     * Add network-routed redemption demand to E1. Must run after every agent's
     * direct losses are in place.
     */
    public static double addRoutedRedemptions(Agent agent, StepContext ctx) {
        double demand = requireLoss(agent, "redemption demand", agent.getBehavior().redemptionDemand(agent, ctx));
        if (demand > 0) {
            LiquidityPosition pos = agent.getLiquidity();
            pos.setE1(pos.getE1() + demand);
            pos.setB1(pos.getB0() - pos.getE1());
            agent.addRedemptions(demand);
        }
        return demand;
    }

    /**
     * Stage 1 for a single agent in isolation: direct losses then routed redemptions.
     */
    public static double computeStage1(Agent agent, StepContext ctx) {
        computeDirectLosses(agent, ctx);
        addRoutedRedemptions(agent, ctx);
        return agent.getLiquidity().getE1();
    }

    private static double requireLoss(Agent agent, String what, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalStateException("Agent " + agent.getId() + ": " + what + " must be finite and >= 0: " + value);
        }
        return value;
    }

    // ========================================================================
    // Stage 2
    // ========================================================================

    /**
     * Degenerate buffers react to any loss; otherwise react when E1/B0 exceeds θ·(1+u).
     */
    public static boolean shouldReact(Agent agent) {
        LiquidityPosition pos = agent.getLiquidity();
        if (agent.isDegenerateBuffer()) {
            return pos.getE1() > 0;
        }
        return pos.stressRatio() > agent.getEffectiveThreshold();
    }

    /**
     * Run the reaction stage. Non-reacting agents keep B2 = B1. Reacting agents
     * run their waterfall against E1; B2 = B1 + Σ amount × efficiency.
     */
    public static void computeStage2(Agent agent, StepContext ctx) {
        LiquidityPosition pos = agent.getLiquidity();
        if (!shouldReact(agent)) {
            agent.setReacted(false);
            pos.setB2(pos.getB1());
            pos.setB3(pos.getB1());
            return;
        }
        agent.setReacted(true);
        Waterfall waterfall = new Waterfall(pos.getE1());
        agent.getBehavior().buildWaterfall(agent, ctx, waterfall);
        agent.setActions(waterfall.getActions());

        double raised = 0.0;
        for (ExecutedAction action : waterfall.getActions()) {
            raised += action.amount() * efficiency(action.reaction(), ctx.market(), ctx.config());
            if (action.reaction().isSale()) {
                agent.addAssetSales(action.amount());
                if (action.reaction().getAssetClass() == AssetClass.GILT) {
                    agent.addGiltSales(action.amount());
                }
            } else if (action.reaction().isRepo()) {
                agent.addRepoDemand(action.amount());
            }
        }
        pos.setB2(pos.getB1() + raised);
        pos.setB3(pos.getB2());
    }

    /**
     * Cash raised per unit of action for an instrument class.
     */
    public static double efficiency(Reaction reaction, MarketState market, EngineConfig config) {
        return switch (reaction.getInstrumentClass()) {
            case SALE -> Math.max(config.getSaleRealisationFloor(), 1.0 - market.getGiltBidAskBps() / 100.0);
            case REPO -> market.getRepoAvailability();
            case CENTRAL_BANK -> config.getCentralBankEfficiency();
            case REDEMPTION -> config.getRedemptionEfficiency();
            case OTHER -> config.getOtherEfficiency();
            case GATE -> 0.0;
        };
    }

    /**
     * Register today's sales and repo demand with the market.
     */
    public static void registerActionsToMarket(Agent agent, MarketState market) {
        for (ExecutedAction action : agent.getActions()) {
            if (action.reaction().isSale()) {
                market.registerSelling(action.reaction().getAssetClass(), action.amount());
            } else if (action.reaction().isRepo()) {
                market.registerRepoDemand(action.amount());
            }
        }
    }

    // ========================================================================
    // Stage 3
    // ========================================================================

    /**
     * Accumulate second-round losses: E2 += e2, B3 = B2 − E2.
     */
    public static void applyStage3(Agent agent, double e2) {
        if (!Double.isFinite(e2) || e2 < 0) {
            throw new IllegalStateException("Agent " + agent.getId() + ": e2 must be finite and >= 0: " + e2);
        }
        LiquidityPosition pos = agent.getLiquidity();
        pos.setE2(pos.getE2() + e2);
        pos.setB3(pos.getB2() - pos.getE2());
    }

    // ========================================================================
    // Realized Sales
    // ========================================================================

    /**
     * Reduce each sold item by its sale amount (never below zero).
     */
    public static void realizeSales(Agent agent) {
        for (ExecutedAction action : agent.getActions()) {
            if (!action.reaction().isSale() || action.sourceItem() == null) continue;
            agent.findItem(action.sourceItem()).ifPresent(item -> item.reduceBy(action.amount()));
        }
    }
}
