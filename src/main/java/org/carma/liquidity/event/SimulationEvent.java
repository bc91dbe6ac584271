package org.carma.liquidity.event;

import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.AssetClass;
import org.carma.liquidity.model.Reaction;

import java.util.Map;

/**
 * Base interface for all simulation events.
 * Events give an audit trail of a run and let callers observe it day by day.
 */
public sealed interface SimulationEvent permits
        SimulationEvent.DayStarted,
        SimulationEvent.AgentReacted,
        SimulationEvent.RepoRefused,
        SimulationEvent.SellingAbsorbed,
        SimulationEvent.DayCompleted {

    int day();
    String eventType();

    // ========================================================================
    // Event Types
    // ========================================================================

    /**
     * Exogenous levels applied for a new day.
     */
    record DayStarted(
            int day,
            String scenario,
            double vix
    ) implements SimulationEvent {
        public String eventType() { return "DAY_STARTED"; }
    }

    /**
     * An agent crossed its threshold and ran its waterfall.
     */
    record AgentReacted(
            int day,
            String agentId,
            AgentType agentType,
            double stressRatio,
            Map<Reaction, Double> reactions
    ) implements SimulationEvent {
        public AgentReacted {
            reactions = Map.copyOf(reactions);
        }

        public String eventType() { return "AGENT_REACTED"; }
    }

    /**
     * Every bank the agent asked refused its repo request.
     */
    record RepoRefused(
            int day,
            String agentId,
            double ask
    ) implements SimulationEvent {
        public String eventType() { return "REPO_REFUSED"; }
    }

    /**
     * Dealer absorption of one asset class's selling.
     */
    record SellingAbsorbed(
            int day,
            AssetClass assetClass,
            double selling,
            double absorbed
    ) implements SimulationEvent {
        public String eventType() { return "SELLING_ABSORBED"; }
    }

    /**
     * Day finished: snapshots taken and sales realized.
     */
    record DayCompleted(
            int day,
            int reactingAgents,
            double totalDirectLoss,
            double totalSecondRoundLoss
    ) implements SimulationEvent {
        public String eventType() { return "DAY_COMPLETED"; }
    }
}
