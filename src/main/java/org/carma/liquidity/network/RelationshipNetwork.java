package org.carma.liquidity.network;

import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AgentType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable multi-relation network between agents.
 *
 * Adjacency is indexed by agent id and edge kind, so every lookup touches only
 * the relevant edge list. Bank edges are symmetric: a bank sees its hedge funds
 * under {@link EdgeKind#PRIME_BROKERAGE_REPO} and a hedge fund sees its banks
 * under the same kind. Redemption edges are also kept directed so that
 * "funds X redeems from" and "agents redeeming from fund F" stay distinct when
 * fund complexes redeem from each other.
 *
 * Instances are created through {@link Builder}, which rejects unknown ids,
 * self edges and kind/type mismatches.
 */
public class RelationshipNetwork {

    private static final List<String> NONE = List.of();

    private final Map<String, AgentType> types;
    private final Map<String, Map<EdgeKind, List<String>>> adjacency;
    private final Map<String, List<String>> redemptionTargets;
    private final Map<String, List<String>> redeemers;
    private final Map<EdgeKind, Integer> edgeCounts;

    private RelationshipNetwork(Builder builder) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(builder.types));

        Map<String, Map<EdgeKind, List<String>>> adj = new LinkedHashMap<>();
        for (Map.Entry<String, EnumMap<EdgeKind, LinkedHashSet<String>>> e : builder.adjacency.entrySet()) {
            EnumMap<EdgeKind, List<String>> byKind = new EnumMap<>(EdgeKind.class);
            for (Map.Entry<EdgeKind, LinkedHashSet<String>> k : e.getValue().entrySet()) {
                byKind.put(k.getKey(), List.copyOf(k.getValue()));
            }
            adj.put(e.getKey(), Collections.unmodifiableMap(byKind));
        }
        this.adjacency = Collections.unmodifiableMap(adj);
        this.redemptionTargets = freeze(builder.redemptionTargets);
        this.redeemers = freeze(builder.redeemers);
        this.edgeCounts = Collections.unmodifiableMap(new EnumMap<>(builder.edgeCounts));
    }

    private static Map<String, List<String>> freeze(Map<String, LinkedHashSet<String>> source) {
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, LinkedHashSet<String>> e : source.entrySet()) {
            frozen.put(e.getKey(), List.copyOf(e.getValue()));
        }
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * Network with the given agents and no edges.
     */
    public static RelationshipNetwork empty(Collection<Agent> agents) {
        return new Builder().addAgents(agents).build();
    }

    // ========================================================================
    // Membership
    // ========================================================================

    public boolean contains(String id) {
        return types.containsKey(id);
    }

    public AgentType getType(String id) {
        AgentType type = types.get(id);
        if (type == null) {
            throw new IllegalArgumentException("Unknown agent: " + id);
        }
        return type;
    }

    public Set<String> getAgentIds() {
        return types.keySet();
    }

    // ========================================================================
    // Adjacency Queries
    // ========================================================================

    /**
     * Counterparties of an agent under one edge kind, in insertion order.
     */
    public List<String> counterparties(String id, EdgeKind kind) {
        Map<EdgeKind, List<String>> byKind = adjacency.get(id);
        if (byKind == null) return NONE;
        return byKind.getOrDefault(kind, NONE);
    }

    /**
     * Banks connected to a non-bank through its bank edge kind.
     */
    public List<String> banksOf(String nonBankId) {
        EdgeKind kind = EdgeKind.bankEdgeFor(getType(nonBankId));
        return kind == null ? NONE : counterparties(nonBankId, kind);
    }

    /**
     * Non-banks connected to a bank across all bank edge kinds.
     */
    public List<String> nonBanksOf(String bankId) {
        List<String> result = new ArrayList<>();
        for (EdgeKind kind : EdgeKind.values()) {
            if (kind.isBankEdge()) {
                result.addAll(counterparties(bankId, kind));
            }
        }
        return result;
    }

    /**
     * Fund complexes the agent redeems from.
     */
    public List<String> redemptionTargets(String id) {
        return redemptionTargets.getOrDefault(id, NONE);
    }

    /**
     * Agents that redeem from the given fund complex.
     */
    public List<String> redeemersOf(String fundId) {
        return redeemers.getOrDefault(fundId, NONE);
    }

    public boolean isConnected(String a, String b, EdgeKind kind) {
        return counterparties(a, kind).contains(b);
    }

    /**
     * Whether the requester is linked to the bank by any bank edge kind.
     */
    public boolean isConnectedToBank(String requesterId, String bankId) {
        for (EdgeKind kind : EdgeKind.values()) {
            if (kind.isBankEdge() && isConnected(requesterId, bankId, kind)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Bank in-degree per bank edge kind.
     */
    public Map<EdgeKind, Integer> bankDegree(String bankId) {
        Map<EdgeKind, Integer> degree = new EnumMap<>(EdgeKind.class);
        for (EdgeKind kind : EdgeKind.values()) {
            if (kind.isBankEdge()) {
                degree.put(kind, counterparties(bankId, kind).size());
            }
        }
        return degree;
    }

    public int getEdgeCount(EdgeKind kind) {
        return edgeCounts.getOrDefault(kind, 0);
    }

    public int getTotalEdgeCount() {
        return edgeCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * One-line description: agent count and edge count per kind.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(types.size()).append(" agents");
        for (EdgeKind kind : EdgeKind.values()) {
            sb.append(", ").append(kind.name().toLowerCase()).append('=').append(getEdgeCount(kind));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "RelationshipNetwork[" + summary() + "]";
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private final Map<String, AgentType> types = new LinkedHashMap<>();
        private final Map<String, EnumMap<EdgeKind, LinkedHashSet<String>>> adjacency = new LinkedHashMap<>();
        private final Map<String, LinkedHashSet<String>> redemptionTargets = new LinkedHashMap<>();
        private final Map<String, LinkedHashSet<String>> redeemers = new LinkedHashMap<>();
        private final EnumMap<EdgeKind, Integer> edgeCounts = new EnumMap<>(EdgeKind.class);

        public Builder addAgent(String id, AgentType type) {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(type, "type");
            AgentType previous = types.putIfAbsent(id, type);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate agent id: " + id);
            }
            return this;
        }

        public Builder addAgents(Collection<Agent> agents) {
            for (Agent a : agents) {
                addAgent(a.getId(), a.getType());
            }
            return this;
        }

        /**
         * Add an edge. For bank edges the bank comes first; for redemption edges
         * the redeemer comes first and the fund complex second.
         */
        public Builder connect(String first, String second, EdgeKind kind) {
            Objects.requireNonNull(kind, "kind");
            AgentType firstType = requireKnown(first);
            AgentType secondType = requireKnown(second);
            if (first.equals(second)) {
                throw new IllegalArgumentException("Self edge not allowed: " + first);
            }
            if (!kind.allows(firstType, secondType)) {
                throw new IllegalArgumentException(String.format(
                    "Edge %s cannot join %s (%s) to %s (%s)", kind, first, firstType, second, secondType));
            }
            boolean added = link(first, second, kind);
            if (kind == EdgeKind.REDEMPTION) {
                added |= redemptionTargets.computeIfAbsent(first, k -> new LinkedHashSet<>()).add(second);
                redeemers.computeIfAbsent(second, k -> new LinkedHashSet<>()).add(first);
            }
            if (added) {
                edgeCounts.merge(kind, 1, Integer::sum);
            }
            return this;
        }

        private boolean link(String a, String b, EdgeKind kind) {
            boolean added = adjacency.computeIfAbsent(a, k -> new EnumMap<>(EdgeKind.class))
                .computeIfAbsent(kind, k -> new LinkedHashSet<>()).add(b);
            adjacency.computeIfAbsent(b, k -> new EnumMap<>(EdgeKind.class))
                .computeIfAbsent(kind, k -> new LinkedHashSet<>()).add(a);
            return added;
        }

        private AgentType requireKnown(String id) {
            AgentType type = types.get(id);
            if (type == null) {
                throw new IllegalArgumentException("Edge references unknown agent: " + id);
            }
            return type;
        }

        public RelationshipNetwork build() {
            return new RelationshipNetwork(this);
        }
    }
}
