package org.carma.liquidity.agent;

import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.BalanceSheetItem;

import java.util.Optional;

/**
 * Variant specific part of an agent: buffer weights, loss channels and the
 * mitigation waterfall. Each agent owns its own behaviour instance, which also
 * carries the variant's mutable state (repo willingness, recapitalisation used,
 * gate status and so on).
 *
 * The shared stage orchestration lives in
 * {@link org.carma.liquidity.engine.LiquidityMechanics}.
 */
public sealed interface AgentBehavior
        permits BankBehavior, HedgeFundBehavior, LdiPensionBehavior, InsurerBehavior, FundComplexBehavior {

    AgentType type();

    /**
     * Weighted sum of buffer-eligible items. May be zero or negative.
     */
    double weightedBuffer(Agent agent);

    /**
     * Size based floor applied to the weighted buffer.
     */
    double bufferFloor(Agent agent);

    /**
     * Whether an item contributes to mark-to-market losses.
     */
    default boolean marksToMarket(BalanceSheetItem item) {
        return true;
    }

    /**
     * Variant scaling of the raw mark-to-market loss (leverage, hedge offset).
     */
    default double scaleMarkToMarket(Agent agent, double rawLoss) {
        return rawLoss;
    }

    double marginCalls(Agent agent, StepContext ctx);

    /**
     * Outflows the agent faces on its own liabilities (funding run-off, LP
     * redemptions, policy surrenders).
     */
    double ownOutflows(Agent agent, StepContext ctx);

    /**
     * Redemption demand routed to this agent by connected redeemers. Only fund
     * complexes receive any.
     */
    default double redemptionDemand(Agent agent, StepContext ctx) {
        return 0.0;
    }

    /**
     * Run the variant's waterfall against the day's shortfall.
     */
    void buildWaterfall(Agent agent, StepContext ctx, Waterfall waterfall);

    /**
     * Repo funding state for variants that borrow repo from banks.
     */
    default Optional<RepoFunding> repoFunding() {
        return Optional.empty();
    }
}
