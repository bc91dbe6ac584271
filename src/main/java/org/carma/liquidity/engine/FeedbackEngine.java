package org.carma.liquidity.engine;

import org.carma.liquidity.agent.HedgeFundBehavior;
import org.carma.liquidity.config.EngineConfig;
import org.carma.liquidity.market.MarketState;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.BalanceSheetItem;
import org.carma.liquidity.model.ItemCategory;
import org.carma.liquidity.network.EdgeKind;
import org.carma.liquidity.network.RelationshipNetwork;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stage 3: second-round losses propagated through the network and the market.
 *
 * <p>Per iteration each agent receives
 * {@code e2 = bilateral + broadcast + reputation + crowding}:
 * <ul>
 *   <li>bilateral: hedge funds are hit by reacting prime brokers, banks by
 *       reacting hedge fund clients, fund complexes by reacting investors</li>
 *   <li>broadcast: market-wide price impact on liquid holdings, scaled by the
 *       fraction of agents reacting</li>
 *   <li>reputation: a reacting agent's own actions signal weakness</li>
 *   <li>crowding: a reacting agent pays more the more of its peers react</li>
 * </ul>
 *
 * <p>All e2 values of an iteration are computed before any is applied, so the
 * result does not depend on agent order. With nobody reacting every agent gets zero.
 */
public class FeedbackEngine {

    private final EngineConfig config;

    public FeedbackEngine(EngineConfig config) {
        this.config = config;
    }

    /**
     * Compute one iteration's e2 per agent without applying it.
     */
    public Map<String, Double> computeIteration(Map<String, Agent> agents, MarketState market,
                                                RelationshipNetwork network) {
        Map<String, Double> e2 = new LinkedHashMap<>();
        int reacting = countReacting(agents.values());
        if (reacting == 0) {
            for (String id : agents.keySet()) {
                e2.put(id, 0.0);
            }
            return e2;
        }

        double s = market.stressIndex();
        double reactingFraction = (double) reacting / agents.size();
        Map<AgentType, int[]> byType = reactingByType(agents.values());

        for (Agent target : agents.values()) {
            double total = bilateral(target, agents, network, s)
                + broadcast(target, s, reactingFraction);
            if (target.hasReacted()) {
                int[] counts = byType.get(target.getType());
                total += reputation(target, s) + crowding(target, s, counts[0], counts[1]);
            }
            e2.put(target.getId(), total);
        }
        return e2;
    }

    /**
     * Compute and apply one iteration.
     *
     * @return the e2 applied per agent
     */
    public Map<String, Double> applyIteration(Map<String, Agent> agents, MarketState market,
                                              RelationshipNetwork network) {
        Map<String, Double> e2 = computeIteration(agents, market, network);
        for (Map.Entry<String, Double> e : e2.entrySet()) {
            LiquidityMechanics.applyStage3(agents.get(e.getKey()), e.getValue());
        }
        return e2;
    }

    // ========================================================================
    // Components
    // ========================================================================

    double bilateral(Agent target, Map<String, Agent> agents, RelationshipNetwork network, double s) {
        double impact = 0.0;
        switch (target.getType()) {
            case HEDGE_FUND -> {
                double repoBorrowing = target.itemAmount(HedgeFundBehavior.REPO_BORROWING);
                for (String bankId : network.banksOf(target.getId())) {
                    Agent bank = agents.get(bankId);
                    if (bank == null || !bank.hasReacted()) continue;
                    double bankReaction = bank.getTotalActionAmount() / Math.max(bank.getLiquidity().getB0(), 1.0);
                    impact += repoBorrowing * bankReaction * s * config.getHedgeFundFundingStressCoefficient();
                }
            }
            case BANK -> {
                for (String hfId : network.counterparties(target.getId(), EdgeKind.PRIME_BROKERAGE_REPO)) {
                    Agent hf = agents.get(hfId);
                    if (hf == null || !hf.hasReacted()) continue;
                    double hfStress = hf.getLiquidity().getE1() / Math.max(hf.getLiquidity().getB0(), 1.0);
                    int hfBanks = Math.max(network.banksOf(hfId).size(), 1);
                    double exposure = hf.itemAmount(HedgeFundBehavior.REPO_BORROWING) / hfBanks;
                    impact += hfStress * exposure * config.getBankCounterpartyLossCoefficient() * s;
                }
            }
            case FUND_COMPLEX -> {
                for (String redeemerId : network.redeemersOf(target.getId())) {
                    Agent redeemer = agents.get(redeemerId);
                    if (redeemer == null || !redeemer.hasReacted()) continue;
                    impact += redeemer.getTotalActionAmount() * config.getRedemptionPressureCoefficient();
                }
            }
            default -> {
                // LDI and insurers have no bilateral channel
            }
        }
        return impact;
    }

    double broadcast(Agent target, double s, double reactingFraction) {
        double impact = 0.0;
        for (BalanceSheetItem item : target.getBalanceSheet()) {
            if (item.getCategory() != ItemCategory.LIQUID_ASSET) continue;
            for (double sensitivity : item.getSensitivities().values()) {
                impact += item.getAmount() * Math.abs(sensitivity) * 1e-4 * s * config.getBroadcastCoefficient();
            }
        }
        return impact * reactingFraction;
    }

    double reputation(Agent target, double s) {
        return target.getTotalActionAmount()
            * (Math.pow(s, config.getReputationExponent()) - 1.0)
            * config.getReputationCoefficient();
    }

    double crowding(Agent target, double s, int sameTypeReacting, int sameTypeTotal) {
        if (sameTypeTotal == 0) return 0.0;
        double fraction = (double) sameTypeReacting / sameTypeTotal;
        return target.getTotalActionAmount()
            * Math.pow(fraction, config.getCrowdingExponent()) * s * config.getCrowdingCoefficient();
    }

    // ========================================================================
    // Counting
    // ========================================================================

    private static int countReacting(Collection<Agent> agents) {
        int n = 0;
        for (Agent a : agents) {
            if (a.hasReacted()) n++;
        }
        return n;
    }

    /**
     * Per type: {reacting, total}.
     */
    private static Map<AgentType, int[]> reactingByType(Collection<Agent> agents) {
        Map<AgentType, int[]> counts = new EnumMap<>(AgentType.class);
        for (Agent a : agents) {
            int[] c = counts.computeIfAbsent(a.getType(), t -> new int[2]);
            if (a.hasReacted()) c[0]++;
            c[1]++;
        }
        return counts;
    }
}
