package org.carma.liquidity.engine;

import org.carma.liquidity.agent.RepoFunding;
import org.carma.liquidity.market.MarketSnapshot;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.MarketVariable;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Headline figures of a finished run.
 */
public record RunSummary(
        String scenario,
        int days,
        int agentCount,
        int agentsEverReacted,
        Map<AgentType, Integer> reactedByType,
        double totalMarginCalls,
        double totalAssetSales,
        double nonBankGiltSales,
        double totalRepoDemand,
        double totalRedemptions,
        int hedgeFundsSeekingRepo,
        int hedgeFundsRefusedByAll,
        double systemAmplification,
        Map<MarketVariable, Double> finalLevels
) {

    public RunSummary {
        Map<AgentType, Integer> types = new EnumMap<>(AgentType.class);
        types.putAll(reactedByType);
        reactedByType = Collections.unmodifiableMap(types);
        Map<MarketVariable, Double> levels = new EnumMap<>(MarketVariable.class);
        levels.putAll(finalLevels);
        finalLevels = Collections.unmodifiableMap(levels);
    }

    static RunSummary of(String scenario, Collection<Agent> agents, List<AgentSnapshot> snapshots,
                         List<MarketSnapshot> marketHistory, AmplificationReport amplification) {
        Map<AgentType, Integer> reactedByType = new EnumMap<>(AgentType.class);
        Set<String> reacted = new HashSet<>();
        for (AgentSnapshot s : snapshots) {
            if (s.reacted() && reacted.add(s.id())) {
                reactedByType.merge(s.type(), 1, Integer::sum);
            }
        }

        double margin = 0.0;
        double sales = 0.0;
        double nonBankGilt = 0.0;
        double repo = 0.0;
        double redemptions = 0.0;
        int seeking = 0;
        int refused = 0;
        for (Agent a : agents) {
            margin += a.getCumulativeMarginCalls();
            sales += a.getCumulativeAssetSales();
            repo += a.getCumulativeRepoDemand();
            redemptions += a.getCumulativeRedemptions();
            if (!a.isBank()) {
                nonBankGilt += a.getCumulativeGiltSales();
            }
            if (a.getType() == AgentType.HEDGE_FUND) {
                Optional<RepoFunding> funding = a.getBehavior().repoFunding();
                if (funding.isPresent() && funding.get().hasEverSought()) seeking++;
                if (funding.isPresent() && funding.get().isRefusedByAll()) refused++;
            }
        }

        Map<MarketVariable, Double> finalLevels = new EnumMap<>(MarketVariable.class);
        if (!marketHistory.isEmpty()) {
            finalLevels.putAll(marketHistory.get(marketHistory.size() - 1).levels());
        }

        return new RunSummary(scenario, marketHistory.size(), agents.size(), reacted.size(), reactedByType,
            margin, sales, nonBankGilt, repo, redemptions, seeking, refused,
            amplification.getSystemRatio(), finalLevels);
    }

    @Override
    public String toString() {
        return String.format(
            "RunSummary[%s, %d days, %d/%d agents reacted, margin=%.1f, sales=%.1f, nonBankGilt=%.1f, "
                + "repo=%.1f, redemptions=%.1f, hfRepo=%d sought/%d refused, amplification=%.3f]",
            scenario, days, agentsEverReacted, agentCount, totalMarginCalls, totalAssetSales, nonBankGiltSales,
            totalRepoDemand, totalRedemptions, hedgeFundsSeekingRepo, hedgeFundsRefusedByAll, systemAmplification);
    }
}
