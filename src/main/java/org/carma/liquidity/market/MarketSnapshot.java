package org.carma.liquidity.market;

import org.carma.liquidity.model.AssetClass;
import org.carma.liquidity.model.MarketVariable;

import java.util.Map;

/**
 * Immutable end-of-day view of the market state.
 */
public record MarketSnapshot(
        int day,
        Map<MarketVariable, Double> levels,
        double giltBidAskBps,
        double corpBidAskBps,
        double repoAvailability,
        double giltDepth,
        double corpDepth,
        Map<AssetClass, Double> sellingPressure,
        Map<AssetClass, Double> absorbed,
        double repoDemand,
        double endogenousGiltYieldAddBps,
        double endogenousIgSpreadAddBps,
        Map<AssetClass, Double> remainingDealerCapacity
) {

    public MarketSnapshot {
        levels = Map.copyOf(levels);
        sellingPressure = Map.copyOf(sellingPressure);
        absorbed = Map.copyOf(absorbed);
        remainingDealerCapacity = Map.copyOf(remainingDealerCapacity);
    }

    public double level(MarketVariable variable) {
        return levels.getOrDefault(variable, variable.getNeutralLevel());
    }
}
