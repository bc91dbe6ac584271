package org.carma.liquidity.engine;

import org.carma.liquidity.agent.BankBehavior;
import org.carma.liquidity.agent.MarketMakingCapacity;
import org.carma.liquidity.market.MarketState;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AssetClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Distributes the day's registered selling across bank dealer books.
 *
 * Pass one snapshots each bank's remaining capacity; pass two offers each bank
 * {@code selling × remaining_b / Σ remaining}. Because offers are fixed before
 * anyone absorbs, the outcome does not depend on bank iteration order.
 */
public class MarketMakingAbsorber {

    /** Asset classes banks make markets in */
    public static final List<AssetClass> DEALT_CLASSES = List.of(AssetClass.GILT, AssetClass.CORPORATE_BOND);

    /**
     * Absorb registered selling and write absorbed totals and remaining
     * dealer capacity back to the market.
     *
     * @return absorbed amount per dealt asset class
     */
    public Map<AssetClass, Double> absorb(Collection<Agent> agents, MarketState market) {
        List<Agent> banks = new ArrayList<>();
        for (Agent a : agents) {
            if (a.isBank()) banks.add(a);
        }

        Map<AssetClass, Double> result = new EnumMap<>(AssetClass.class);
        for (AssetClass assetClass : DEALT_CLASSES) {
            double selling = market.getSellingPressure(assetClass);

            // Pass 1: snapshot remaining capacity
            double[] remaining = new double[banks.size()];
            double totalRemaining = 0.0;
            for (int i = 0; i < banks.size(); i++) {
                remaining[i] = banks.get(i).asBank().getMarketMaking().getRemaining(assetClass);
                totalRemaining += remaining[i];
            }

            // Pass 2: proportional offers
            double absorbed = 0.0;
            if (selling > 0 && totalRemaining > 0) {
                for (int i = 0; i < banks.size(); i++) {
                    BankBehavior bank = banks.get(i).asBank();
                    double offered = selling * remaining[i] / totalRemaining;
                    absorbed += bank.getMarketMaking().absorb(assetClass, offered, bank.getRiskAppetite());
                }
            }

            market.recordAbsorbed(assetClass, absorbed);
            market.setRemainingDealerCapacity(assetClass, totalRemaining(banks, assetClass));
            result.put(assetClass, absorbed);
        }
        return result;
    }

    private static double totalRemaining(List<Agent> banks, AssetClass assetClass) {
        double total = 0.0;
        for (Agent bank : banks) {
            MarketMakingCapacity capacity = bank.asBank().getMarketMaking();
            total += capacity.getRemaining(assetClass);
        }
        return total;
    }
}
