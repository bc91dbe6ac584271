package org.carma.liquidity.engine;

import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.LiquidityPosition;
import org.carma.liquidity.model.Reaction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * End-of-day state of one agent.
 */
public record AgentSnapshot(
        int day,
        String id,
        AgentType type,
        double b0,
        double b1,
        double b2,
        double b3,
        double e1,
        double e1Direct,
        double e2,
        boolean reacted,
        boolean degenerateBuffer,
        double cumulativeMarginCalls,
        double cumulativeAssetSales,
        double cumulativeGiltSales,
        double cumulativeRepoDemand,
        double cumulativeRedemptions,
        Map<Reaction, Double> reactions
) {

    public AgentSnapshot {
        // keeps waterfall order
        reactions = Collections.unmodifiableMap(new LinkedHashMap<>(reactions));
    }

    public static AgentSnapshot of(int day, Agent agent) {
        LiquidityPosition pos = agent.getLiquidity();
        return new AgentSnapshot(day, agent.getId(), agent.getType(),
            pos.getB0(), pos.getB1(), pos.getB2(), pos.getB3(),
            pos.getE1(), pos.getE1Direct(), pos.getE2(),
            agent.hasReacted(), agent.isDegenerateBuffer(),
            agent.getCumulativeMarginCalls(), agent.getCumulativeAssetSales(),
            agent.getCumulativeGiltSales(), agent.getCumulativeRepoDemand(),
            agent.getCumulativeRedemptions(), agent.getReactions());
    }

    /**
     * E1 / B0 for the day.
     */
    public double stressRatio() {
        return e1 / b0;
    }

    /**
     * First-round buffer loss B0 − B1.
     */
    public double directLoss() {
        return b0 - b1;
    }

    public double totalActionAmount() {
        double total = 0.0;
        for (double amount : reactions.values()) {
            total += amount;
        }
        return total;
    }
}
