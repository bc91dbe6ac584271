package org.carma.liquidity.network;

import org.carma.liquidity.config.NetworkRules;
import org.carma.liquidity.config.ParameterRange;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AgentType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Builds a relationship network from a population.
 *
 * Each non-bank draws its banks, and each redeemer its fund complexes, by
 * weighted sampling without replacement with weights proportional to the
 * counterparty's size factor. Bank in-degrees emerge from those draws.
 * The same seed and population always give the same network.
 */
public class NetworkGenerator {

    private static final Logger log = LoggerFactory.getLogger(NetworkGenerator.class);

    private final long seed;
    private final NetworkRules rules;

    public NetworkGenerator(long seed, NetworkRules rules) {
        this.seed = seed;
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public NetworkGenerator(long seed) {
        this(seed, NetworkRules.DEFAULT);
    }

    public long getSeed() {
        return seed;
    }

    /**
     * Generate the network for a population.
     */
    public RelationshipNetwork generate(List<Agent> agents) {
        Random random = new Random(seed);
        RelationshipNetwork.Builder builder = new RelationshipNetwork.Builder().addAgents(agents);

        List<Agent> banks = ofType(agents, AgentType.BANK);
        List<Agent> funds = ofType(agents, AgentType.FUND_COMPLEX);

        // Non-bank to bank edges
        for (Agent agent : agents) {
            ParameterRange degree = bankDegree(agent.getType());
            if (degree == null || banks.isEmpty()) continue;
            EdgeKind kind = EdgeKind.bankEdgeFor(agent.getType());
            for (Agent bank : sampleWeighted(banks, degree.sampleInt(random), random)) {
                builder.connect(bank.getId(), agent.getId(), kind);
            }
        }

        // Redemption edges from hedge funds, LDI funds and insurers
        for (Agent agent : agents) {
            if (!agent.getType().isNonBank() || agent.getType() == AgentType.FUND_COMPLEX || funds.isEmpty()) {
                continue;
            }
            int n = rules.getNonBankFundDegree().sampleInt(random);
            for (Agent fund : sampleWeighted(funds, n, random)) {
                builder.connect(agent.getId(), fund.getId(), EdgeKind.REDEMPTION);
            }
        }

        // Fund complexes redeeming from each other
        for (Agent fund : funds) {
            List<Agent> others = new ArrayList<>(funds);
            others.remove(fund);
            if (others.isEmpty()) continue;
            int n = rules.getFundFundDegree().sampleInt(random);
            for (Agent target : sampleWeighted(others, n, random)) {
                builder.connect(fund.getId(), target.getId(), EdgeKind.REDEMPTION);
            }
        }

        RelationshipNetwork network = builder.build();
        log.info("Generated network (seed={}): {}", seed, network.summary());
        return network;
    }

    private ParameterRange bankDegree(AgentType type) {
        return switch (type) {
            case HEDGE_FUND -> rules.getHedgeFundBankDegree();
            case LDI_PENSION -> rules.getLdiBankDegree();
            case INSURER -> rules.getInsurerBankDegree();
            default -> null;
        };
    }

    private static List<Agent> ofType(List<Agent> agents, AgentType type) {
        List<Agent> result = new ArrayList<>();
        for (Agent a : agents) {
            if (a.getType() == type) {
                result.add(a);
            }
        }
        return result;
    }

    /**
     * Draw up to n distinct candidates, each draw proportional to size factor.
     * Candidates with zero size are drawn uniformly once all weights are zero.
     */
    static List<Agent> sampleWeighted(List<Agent> candidates, int n, Random random) {
        List<Agent> pool = new ArrayList<>(candidates);
        List<Agent> chosen = new ArrayList<>();
        int draws = Math.min(n, pool.size());
        for (int d = 0; d < draws; d++) {
            double total = 0.0;
            for (Agent a : pool) {
                total += a.getSizeFactor();
            }
            int index;
            if (total <= 0) {
                index = random.nextInt(pool.size());
            } else {
                double r = random.nextDouble() * total;
                index = pool.size() - 1;
                double cumulative = 0.0;
                for (int i = 0; i < pool.size(); i++) {
                    cumulative += pool.get(i).getSizeFactor();
                    if (r < cumulative) {
                        index = i;
                        break;
                    }
                }
            }
            chosen.add(pool.remove(index));
        }
        return chosen;
    }
}
