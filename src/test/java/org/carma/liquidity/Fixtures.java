package org.carma.liquidity;

import org.carma.liquidity.agent.BankBehavior;
import org.carma.liquidity.agent.FundComplexBehavior;
import org.carma.liquidity.agent.HedgeFundBehavior;
import org.carma.liquidity.agent.StepContext;
import org.carma.liquidity.config.EngineConfig;
import org.carma.liquidity.market.MarketState;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.HedgeFundStrategy;
import org.carma.liquidity.network.RelationshipNetwork;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hand-built agents and contexts shared by tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    /**
     * Bank with B0 = 0.15 × 12000 + 0.08 × 6000 − 0.10 × 5000 = 1780.
     */
    public static Agent bank(String id) {
        return new BankBehavior.Builder(id)
            .theta(0.40)
            .bufferUsability(0.5)
            .totalBalanceSheet(100_000)
            .giltHoldings(10_000)
            .corporateBonds(5_000)
            .equityPortfolio(500)
            .repoLending(8_000)
            .derivativeAssets(6_000)
            .centralBankEligible(12_000)
            .wholesaleFunding(5_000)
            .cet1Buffer(6_000)
            .riskAppetite(0.5)
            .repoCapacity(5_000)
            .repoWillingness(0.8, 0.9)
            .marketMakingCapacity(2_000, 600)
            .build();
    }

    public static Agent hedgeFund(String id, HedgeFundStrategy strategy) {
        return new HedgeFundBehavior.Builder(id, strategy)
            .theta(0.25)
            .bufferUsability(0.2)
            .aum(2_000)
            .leverage(3.0)
            .varUtilisation(0.7)
            .build();
    }

    public static Agent hedgeFund(String id) {
        return hedgeFund(id, HedgeFundStrategy.MACRO_RATES);
    }

    public static Agent fund(String id, double cash, double gilts) {
        return new FundComplexBehavior.Builder(id)
            .cash(cash)
            .giltHoldings(gilts)
            .build();
    }

    public static Map<String, Agent> byId(List<Agent> agents) {
        Map<String, Agent> map = new LinkedHashMap<>();
        for (Agent a : agents) {
            map.put(a.getId(), a);
        }
        return map;
    }

    public static StepContext context(List<Agent> agents, RelationshipNetwork network, EngineConfig config) {
        return new StepContext(0, new MarketState(), Map.of(), network, byId(agents), config);
    }

    public static StepContext context(List<Agent> agents, RelationshipNetwork network) {
        return context(agents, network, EngineConfig.DEFAULT);
    }
}
