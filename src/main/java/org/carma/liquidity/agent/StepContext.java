package org.carma.liquidity.agent;

import org.carma.liquidity.config.EngineConfig;
import org.carma.liquidity.market.MarketState;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.MarketVariable;
import org.carma.liquidity.network.RelationshipNetwork;

import java.util.Map;

/**
 * Everything a behaviour may read while computing one day's stages.
 *
 * @param day      zero-based simulated day
 * @param market   the shared market state
 * @param dayDelta day-over-day change of each driven market variable
 * @param network  relationship network
 * @param agents   agent directory keyed by id
 * @param config   engine configuration
 */
public record StepContext(
        int day,
        MarketState market,
        Map<MarketVariable, Double> dayDelta,
        RelationshipNetwork network,
        Map<String, Agent> agents,
        EngineConfig config
) {

    public double delta(MarketVariable variable) {
        return dayDelta.getOrDefault(variable, 0.0);
    }

    /**
     * Look up a counterparty.
     * @throws IllegalArgumentException if the id is not part of the run
     */
    public Agent agent(String id) {
        Agent agent = agents.get(id);
        if (agent == null) {
            throw new IllegalArgumentException("Unknown agent: " + id);
        }
        return agent;
    }
}
